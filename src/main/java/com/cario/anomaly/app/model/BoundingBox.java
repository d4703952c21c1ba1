package com.cario.anomaly.app.model;

/** Diagonal corners of a detected word, in normalized image coordinates. */
public record BoundingBox(Point topLeft, Point bottomRight) {}
