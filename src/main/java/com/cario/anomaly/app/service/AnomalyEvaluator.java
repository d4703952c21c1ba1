package com.cario.anomaly.app.service;

import com.cario.anomaly.app.model.DetectedWord;
import com.cario.anomaly.app.model.DetectionResult;

/** Decides whether detected text is clear enough to skip the anomaly report. */
public class AnomalyEvaluator {

  public static final double DEFAULT_THRESHOLD = 0.90;

  private final double threshold;

  public AnomalyEvaluator(double threshold) {
    if (threshold < 0.0 || threshold > 1.0) {
      throw new IllegalArgumentException("threshold must be within 0..1, got " + threshold);
    }
    this.threshold = threshold;
  }

  public AnomalyEvaluator() {
    this(DEFAULT_THRESHOLD);
  }

  public double threshold() {
    return threshold;
  }

  public boolean isClear(DetectionResult result) {
    return isClear(result, threshold);
  }

  /**
   * True iff every word's confidence is at least {@code threshold}. An empty result is clear.
   */
  public static boolean isClear(DetectionResult result, double threshold) {
    for (DetectedWord word : result.words()) {
      if (word.confidence() < threshold) return false;
    }
    return true;
  }
}
