package com.cario.anomaly.app.model;

import java.time.Instant;

/** Read-only, time-limited URL for a single stored object. */
public record AccessLink(String url, Instant expiresAt) {}
