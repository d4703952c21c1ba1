package com.cario.anomaly.app.model;

/** Caller-facing outcome of one pipeline run. */
public sealed interface PipelineResult
    permits PipelineResult.NoAnomaly, PipelineResult.ReportReady, PipelineResult.Failure {

  /** Every detected word met the confidence threshold; no report was produced. */
  record NoAnomaly(String message) implements PipelineResult {}

  /** A report was generated and can be downloaded through {@code accessLink}. */
  record ReportReady(String inputUrl, AccessLink accessLink) implements PipelineResult {}

  /** A recognized stage failure. */
  record Failure(String message, PipelineStage stage) implements PipelineResult {}
}
