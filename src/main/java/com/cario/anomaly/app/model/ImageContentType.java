package com.cario.anomaly.app.model;

import java.util.Locale;
import org.apache.commons.io.FilenameUtils;

/** Image formats accepted by the pipeline, keyed by file extension. */
public enum ImageContentType {
  JPEG("image/jpeg"),
  PNG("image/png"),
  UNKNOWN(null);

  private final String mimeType;

  ImageContentType(String mimeType) {
    this.mimeType = mimeType;
  }

  public String mimeType() {
    return mimeType;
  }

  public boolean isSupported() {
    return this != UNKNOWN;
  }

  /**
   * Resolves the content type from a file name's extension. Only {@code jpg}, {@code jpeg} and
   * {@code png} are recognized (case-insensitive).
   */
  public static ImageContentType fromFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) return UNKNOWN;
    String ext = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
    switch (ext) {
      case "jpg":
      case "jpeg":
        return JPEG;
      case "png":
        return PNG;
      default:
        return UNKNOWN;
    }
  }
}
