package com.cario.anomaly.app.model.report;

/**
 * One row of the anomaly report.
 *
 * @param word detected text
 * @param confidence confidence as a percentage, one decimal place
 * @param corner1 first polygon vertex (top-left), two decimal places
 * @param corner3 third polygon vertex (bottom-right), two decimal places
 */
public record WordEntry(String word, double confidence, Corner corner1, Corner corner3) {}
