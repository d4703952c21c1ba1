package com.cario.anomaly.app.model.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Application-level reply of the document generation function. {@code code == 200} means the PDF
 * was written to storage.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentGenerationResponse(Integer code, String message) {

  public boolean isSuccess() {
    return code != null && code == 200;
  }
}
