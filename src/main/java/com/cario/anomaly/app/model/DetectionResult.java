package com.cario.anomaly.app.model;

import java.util.List;

/** Ordered words returned by text detection. May be empty. */
public record DetectionResult(List<DetectedWord> words) {

  public DetectionResult {
    words = (words == null) ? List.of() : List.copyOf(words);
  }

  public static DetectionResult empty() {
    return new DetectionResult(List.of());
  }

  public int size() {
    return words.size();
  }
}
