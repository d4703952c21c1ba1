package com.cario.anomaly.app.model;

/** A normalized (0..1) image coordinate. */
public record Point(double x, double y) {}
