package com.cario.anomaly.app.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.cario.anomaly.app.model.BoundingBox;
import com.cario.anomaly.app.model.DetectedWord;
import com.cario.anomaly.app.model.DetectionResult;
import com.cario.anomaly.app.model.Point;
import com.cario.anomaly.app.model.StoredObjectRef;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest;
import com.cario.anomaly.app.model.report.ReportData;
import com.cario.anomaly.app.model.report.WordEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReportPayloadBuilderTest {

  private static final StoredObjectRef IMAGE =
      new StoredObjectRef("ns", "bucket", "part3/1234-photo.png");

  private final ReportPayloadBuilder builder =
      new ReportPayloadBuilder("part3/TextAnomalyTemplate.docx", "part3/Monoton.zip");

  @Test
  void percentageRoundsToOneDecimalAndIsStable() {
    assertThat(ReportPayloadBuilder.percentage(0.8234)).isEqualTo(82.3);
    assertThat(ReportPayloadBuilder.round(82.3, 1)).isEqualTo(82.3);
    assertThat(ReportPayloadBuilder.percentage(0.5)).isEqualTo(50.0);
    assertThat(ReportPayloadBuilder.percentage(0.99996)).isEqualTo(100.0);
  }

  @Test
  void buildsOneRowPerWordWithRoundedCorners() {
    DetectionResult result =
        new DetectionResult(
            List.of(
                new DetectedWord(
                    "Hello",
                    0.8234,
                    new BoundingBox(new Point(0.12345, 0.5678), new Point(0.3333, 0.6666))),
                new DetectedWord(
                    "World", 0.97, new BoundingBox(new Point(0.4, 0.5), new Point(0.6, 0.7)))));

    ReportData data = builder.build(result, IMAGE);

    assertThat(data.words()).hasSize(2);
    WordEntry first = data.words().get(0);
    assertThat(first.word()).isEqualTo("Hello");
    assertThat(first.confidence()).isEqualTo(82.3);
    assertThat(first.corner1().x()).isEqualTo(0.12);
    assertThat(first.corner1().y()).isEqualTo(0.57);
    assertThat(first.corner3().x()).isEqualTo(0.33);
    assertThat(first.corner3().y()).isEqualTo(0.67);
    assertThat(data.words().get(1).word()).isEqualTo("World");

    assertThat(data.imageWithAnomalies().objectName()).isEqualTo("part3/1234-photo.png");
    assertThat(data.imageWithAnomalies().bucketName()).isEqualTo("bucket");
    assertThat(data.imageWithAnomalies().namespace()).isEqualTo("ns");
    assertThat(data.imageWithAnomalies().source()).isEqualTo("OBJECT_STORAGE");
  }

  @Test
  void emptyDetectionGivesEmptyRows() {
    assertThat(builder.build(DetectionResult.empty(), IMAGE).words()).isEmpty();
  }

  @Test
  void reportKeyReplacesExtension() {
    assertThat(ReportPayloadBuilder.reportObjectKey("a/b-photo.png")).isEqualTo("a/b-photo.pdf");
    assertThat(ReportPayloadBuilder.reportObjectKey("a/b-photo.jpeg")).isEqualTo("a/b-photo.pdf");
    assertThat(ReportPayloadBuilder.reportObjectKey("a/noext")).isEqualTo("a/noext.pdf");
  }

  @Test
  void requestSerializesWithTemplateFontAndOutputReferences() throws Exception {
    ReportData data = builder.build(AnomalyEvaluatorTest.words(0.5), IMAGE);
    DocumentGenerationRequest request = builder.buildRequest(data, IMAGE);

    JsonNode json = new ObjectMapper().valueToTree(request);

    assertThat(json.path("requestType").asText()).isEqualTo("SINGLE");
    assertThat(json.path("tagSyntax").path("openDelimiter").asText()).isEqualTo("{");
    assertThat(json.path("data").path("source").asText()).isEqualTo("INLINE");
    JsonNode content = json.path("data").path("content");
    assertThat(content.path("image_with_anomalies").path("objectName").asText())
        .isEqualTo("part3/1234-photo.png");
    assertThat(content.path("words").get(0).path("confidence").asDouble()).isEqualTo(50.0);
    assertThat(json.path("template").path("objectName").asText())
        .isEqualTo("part3/TextAnomalyTemplate.docx");
    assertThat(json.path("template").path("source").asText()).isEqualTo("OBJECT_STORAGE");
    assertThat(json.path("output").path("target").asText()).isEqualTo("OBJECT_STORAGE");
    assertThat(json.path("output").path("objectName").asText()).isEqualTo("part3/1234-photo.pdf");
    assertThat(json.path("output").path("contentType").asText()).isEqualTo("application/pdf");
    assertThat(json.path("fonts").path("objectName").asText()).isEqualTo("part3/Monoton.zip");
    assertThat(json.path("fonts").has("contentType")).isFalse();
    assertThat(json.path("locale").asText()).isEqualTo("en");
  }
}
