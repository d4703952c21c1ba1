package com.cario.anomaly.app;

import com.cario.anomaly.app.config.ApiKeyProperties;
import com.cario.anomaly.app.config.PipelineProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Text Anomaly Service Spring Boot application.
 *
 * <p>This service downloads an image, runs text detection on it and, when some words fall below
 * the confidence threshold, produces a PDF anomaly report with a time-limited download link.
 *
 * <p>Logging is provided via Lombok's {@code @Log4j2} annotation, which injects a {@code log} field
 * for Log4j2-based logging. Usage:
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 *
 * @author Shaji Nair
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties({PipelineProperties.class, ApiKeyProperties.class})
public class TextAnomalyServiceApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting Text Anomaly Service application...");
    SpringApplication.run(TextAnomalyServiceApplication.class, args);
    log.info("Text Anomaly Service application started successfully.");
  }
}
