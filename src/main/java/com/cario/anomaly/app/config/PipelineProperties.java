package com.cario.anomaly.app.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Static configuration of the anomaly pipeline, bound from {@code anomaly.pipeline.*}.
 *
 * <p>Built once at startup and handed to every component through its constructor.
 *
 * @param namespace logical storage namespace written into report payloads
 * @param bucket bucket holding source images and generated reports
 * @param objectPrefix key prefix for every object the pipeline writes
 * @param confidenceThreshold minimum per-word confidence (0..1) for a word to count as clear
 * @param linkExpiry lifetime of the report download link
 * @param reportFunctionName name or ARN of the document generation function
 * @param templateKey object key of the report template
 * @param fontArchiveKey object key of the font archive used by the template
 * @param maxImageSize largest image body the fetcher buffers
 */
@Validated
@ConfigurationProperties(prefix = "anomaly.pipeline")
public record PipelineProperties(
    @NotBlank String namespace,
    @NotBlank String bucket,
    @DefaultValue("part3") String objectPrefix,
    @DefaultValue("0.90") @DecimalMin("0.0") @DecimalMax("1.0") double confidenceThreshold,
    @DefaultValue("1h") @NotNull Duration linkExpiry,
    @NotBlank String reportFunctionName,
    @DefaultValue("part3/TextAnomalyTemplate.docx") String templateKey,
    @DefaultValue("part3/Monoton.zip") String fontArchiveKey,
    @DefaultValue("10MB") @NotNull DataSize maxImageSize) {

  /** Prefix without trailing slash. */
  public String normalizedPrefix() {
    if (objectPrefix == null || objectPrefix.isBlank()) return "";
    String p = objectPrefix.trim();
    while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
    return p;
  }
}
