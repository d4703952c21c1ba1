package com.cario.anomaly.app.model.report;

/** Points the document generator at the stored source image instead of embedding it. */
public record ImageReference(
    String source,
    String objectName,
    String namespace,
    String bucketName,
    String mediaType,
    String height) {}
