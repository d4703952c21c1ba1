package com.cario.anomaly.app.model.report;

/** Rounded corner coordinate as rendered in the report table. */
public record Corner(double x, double y) {}
