package com.cario.anomaly.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;

/**
 * API gateway authorizer: checks the {@code data.api-key} field of the authorizer payload against
 * a fixed set of keys.
 */
@Log4j2
public class ApiKeyAuthorizerService {

  private final Set<String> validKeys;
  private final ObjectMapper mapper;

  public ApiKeyAuthorizerService(List<String> validKeys, ObjectMapper mapper) {
    this.validKeys =
        (validKeys == null)
            ? Set.of()
            : validKeys.stream()
                .filter(k -> k != null && !k.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    this.mapper = Objects.requireNonNull(mapper);
  }

  /** Malformed payloads are unauthorized, never errors. */
  public boolean isAuthorized(String payload) {
    if (payload == null || payload.isBlank()) {
      log.info("auth.result=unauthorized reason=empty-payload");
      return false;
    }
    try {
      JsonNode token = mapper.readTree(payload).path("data").path("api-key");
      boolean ok = token.isTextual() && validKeys.contains(token.asText());
      log.info("auth.result={}", ok ? "authorized" : "unauthorized");
      return ok;
    } catch (Exception e) {
      log.info("auth.result=unauthorized reason=unparseable-payload msg={}", e.getMessage());
      return false;
    }
  }
}
