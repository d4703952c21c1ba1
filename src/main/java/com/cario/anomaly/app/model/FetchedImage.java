package com.cario.anomaly.app.model;

import lombok.Builder;
import lombok.Value;

/** Raw result of downloading an image from a remote URL. */
@Value
@Builder
public class FetchedImage {
  int statusCode;
  byte[] bytes;
  String fileName; // last path segment of the source URL
  ImageContentType contentType;

  public boolean isOk() {
    return statusCode == 200;
  }
}
