package com.cario.anomaly.app.model;

/**
 * Outcome of a single pipeline stage: either a value for the next stage or a structured failure.
 *
 * @param <T> type of the value handed to the next stage
 */
public sealed interface StageResult<T> permits StageResult.Success, StageResult.Failed {

  /** The stage output. Only valid on {@link Success}. */
  T value();

  static <T> StageResult<T> success(T value) {
    return new Success<>(value);
  }

  static <T> StageResult<T> failed(PipelineStage stage, String message) {
    return new Failed<>(stage, message);
  }

  record Success<T>(T value) implements StageResult<T> {}

  record Failed<T>(PipelineStage stage, String message) implements StageResult<T> {
    @Override
    public T value() {
      throw new IllegalStateException("Stage " + stage + " failed: " + message);
    }
  }
}
