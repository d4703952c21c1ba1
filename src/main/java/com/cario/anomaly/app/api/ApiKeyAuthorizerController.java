package com.cario.anomaly.app.api;

import com.cario.anomaly.app.service.ApiKeyAuthorizerService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Authorizer endpoint for the API gateway in front of {@code /anomaly}. */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class ApiKeyAuthorizerController {

  private final ApiKeyAuthorizerService authorizer;

  @PostMapping(path = "/validate", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> validate(
      @RequestBody(required = false) String payload) {
    if (authorizer.isAuthorized(payload)) {
      return ResponseEntity.ok(Map.of("active", true));
    }
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("active", false);
    body.put("wwwAuthenticate", "API-key");
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
  }
}
