package com.cario.anomaly.app.service;

import com.cario.anomaly.app.config.PipelineProperties;
import com.cario.anomaly.app.model.BoundingBox;
import com.cario.anomaly.app.model.DetectedWord;
import com.cario.anomaly.app.model.DetectionResult;
import com.cario.anomaly.app.model.StoredObjectRef;
import com.cario.anomaly.app.model.report.Corner;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest.InlineData;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest.StorageAsset;
import com.cario.anomaly.app.model.report.ImageReference;
import com.cario.anomaly.app.model.report.ReportData;
import com.cario.anomaly.app.model.report.WordEntry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.apache.commons.io.FilenameUtils;

/**
 * Turns detection results into the document generator's input: rounded per-word rows plus storage
 * references for the source image, the template, the fonts and the PDF output.
 */
public class ReportPayloadBuilder {

  static final String IMAGE_MEDIA_TYPE = "image/png";
  static final String IMAGE_HEIGHT = "450px";

  private final String templateKey;
  private final String fontArchiveKey;

  public ReportPayloadBuilder(PipelineProperties properties) {
    this(properties.templateKey(), properties.fontArchiveKey());
  }

  public ReportPayloadBuilder(String templateKey, String fontArchiveKey) {
    this.templateKey = templateKey;
    this.fontArchiveKey = fontArchiveKey;
  }

  public ReportData build(DetectionResult result, StoredObjectRef image) {
    ImageReference imageRef =
        new ImageReference(
            DocumentGenerationRequest.SOURCE_OBJECT_STORAGE,
            image.objectKey(),
            image.namespace(),
            image.bucket(),
            IMAGE_MEDIA_TYPE,
            IMAGE_HEIGHT);

    List<WordEntry> words = result.words().stream().map(ReportPayloadBuilder::toEntry).toList();
    return new ReportData(imageRef, words);
  }

  /** Wraps report data with template, font and output locations in the image's bucket. */
  public DocumentGenerationRequest buildRequest(ReportData data, StoredObjectRef image) {
    return DocumentGenerationRequest.builder()
        .data(InlineData.of(data))
        .template(
            StorageAsset.input(
                image.namespace(),
                image.bucket(),
                templateKey,
                DocumentGenerationRequest.DOCX_CONTENT_TYPE))
        .output(
            StorageAsset.output(
                image.namespace(),
                image.bucket(),
                reportObjectKey(image.objectKey()),
                DocumentGenerationRequest.PDF_CONTENT_TYPE))
        .fonts(StorageAsset.input(image.namespace(), image.bucket(), fontArchiveKey, null))
        .build();
  }

  /** Report key for an image key: same key with its extension replaced by {@code .pdf}. */
  public static String reportObjectKey(String imageObjectKey) {
    return FilenameUtils.removeExtension(imageObjectKey) + ".pdf";
  }

  static WordEntry toEntry(DetectedWord word) {
    BoundingBox box = word.boundingBox();
    return new WordEntry(
        word.text(),
        percentage(word.confidence()),
        new Corner(round(box.topLeft().x(), 2), round(box.topLeft().y(), 2)),
        new Corner(round(box.bottomRight().x(), 2), round(box.bottomRight().y(), 2)));
  }

  /** 0..1 confidence as a percentage with one decimal place. */
  public static double percentage(double confidence) {
    return BigDecimal.valueOf(confidence)
        .movePointRight(2)
        .setScale(1, RoundingMode.HALF_UP)
        .doubleValue();
  }

  public static double round(double value, int places) {
    return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }
}
