package com.cario.anomaly.app.service;

import com.cario.anomaly.app.model.BoundingBox;
import com.cario.anomaly.app.model.DetectedWord;
import com.cario.anomaly.app.model.DetectionResult;
import com.cario.anomaly.app.model.Point;
import com.cario.anomaly.app.model.StoredObjectRef;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Document;
import software.amazon.awssdk.services.textract.model.Geometry;
import software.amazon.awssdk.services.textract.model.S3Object;

/** Runs Textract text detection on a stored image and keeps the WORD blocks. */
@Log4j2
public class TextDetectionClient {

  private final TextractClient textractClient;

  public TextDetectionClient(TextractClient textractClient) {
    this.textractClient = Objects.requireNonNull(textractClient, "textractClient must not be null");
  }

  /**
   * Detects words in the referenced image. Service errors are not caught here.
   *
   * @return words in response order, confidence rescaled to 0..1
   */
  public DetectionResult detect(StoredObjectRef image) {
    Document document =
        Document.builder()
            .s3Object(S3Object.builder().bucket(image.bucket()).name(image.objectKey()).build())
            .build();

    DetectDocumentTextResponse response =
        textractClient.detectDocumentText(
            DetectDocumentTextRequest.builder().document(document).build());

    List<DetectedWord> words =
        response.blocks().stream()
            .filter(b -> b.blockType() == BlockType.WORD)
            .map(TextDetectionClient::toWord)
            .toList();

    log.info(
        "textract.detect s3={} blocks={} words={}",
        image.s3Uri(),
        response.blocks().size(),
        words.size());
    return new DetectionResult(words);
  }

  static DetectedWord toWord(Block b) {
    double confidence = b.confidence() == null ? 0.0 : b.confidence() / 100.0;
    return new DetectedWord(b.text(), confidence, boundingBox(b.geometry()));
  }

  /** Diagonal corners from polygon vertices 0 and 2, falling back to the axis-aligned box. */
  static BoundingBox boundingBox(Geometry g) {
    if (g == null) return new BoundingBox(new Point(0, 0), new Point(0, 0));
    if (g.hasPolygon() && g.polygon().size() >= 3) {
      var p0 = g.polygon().get(0);
      var p2 = g.polygon().get(2);
      return new BoundingBox(
          new Point(value(p0.x()), value(p0.y())), new Point(value(p2.x()), value(p2.y())));
    }
    var box = g.boundingBox();
    if (box == null) return new BoundingBox(new Point(0, 0), new Point(0, 0));
    double left = value(box.left());
    double top = value(box.top());
    return new BoundingBox(
        new Point(left, top), new Point(left + value(box.width()), top + value(box.height())));
  }

  private static double value(Float f) {
    return f == null ? 0.0 : f.doubleValue();
  }
}
