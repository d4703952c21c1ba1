package com.cario.anomaly.app.config;

import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Keys accepted by the API gateway authorizer endpoint. */
@Data
@ConfigurationProperties(prefix = "auth")
public class ApiKeyProperties {
  private List<String> apiKeys = List.of();
}
