package com.cario.anomaly.app.model;

/**
 * A single word found by text detection.
 *
 * @param text the detected text
 * @param confidence detection confidence in the range 0..1
 * @param boundingBox location of the word in the image
 */
public record DetectedWord(String text, double confidence, BoundingBox boundingBox) {}
