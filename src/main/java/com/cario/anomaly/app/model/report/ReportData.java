package com.cario.anomaly.app.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Template data for the anomaly report. Property names match the tags in the report template. */
public record ReportData(
    @JsonProperty("image_with_anomalies") ImageReference imageWithAnomalies,
    @JsonProperty("words") List<WordEntry> words) {}
