package com.cario.anomaly.app.model;

/**
 * Result of requesting a read-only link from storage.
 *
 * @param statusCode storage status code for the request
 * @param link the link, or null when storage accepted the request but produced none
 */
public record LinkResult(int statusCode, AccessLink link) {}
