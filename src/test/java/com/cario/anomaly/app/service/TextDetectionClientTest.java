package com.cario.anomaly.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cario.anomaly.app.model.DetectedWord;
import com.cario.anomaly.app.model.DetectionResult;
import com.cario.anomaly.app.model.StoredObjectRef;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextRequest;
import software.amazon.awssdk.services.textract.model.DetectDocumentTextResponse;
import software.amazon.awssdk.services.textract.model.Geometry;
import software.amazon.awssdk.services.textract.model.Point;
import software.amazon.awssdk.services.textract.model.TextractException;

@ExtendWith(MockitoExtension.class)
class TextDetectionClientTest {

  private static final StoredObjectRef IMAGE =
      new StoredObjectRef("ns", "bucket", "part3/1234-photo.png");

  @Mock private TextractClient textract;

  @Test
  void keepsWordsInOrderWithRescaledConfidenceAndDiagonalCorners() {
    Geometry polygon =
        Geometry.builder()
            .polygon(
                point(0.10f, 0.20f), point(0.30f, 0.20f), point(0.30f, 0.25f), point(0.10f, 0.25f))
            .build();
    Block line =
        Block.builder().blockType(BlockType.LINE).text("Hello World").confidence(99f).build();
    Block hello =
        Block.builder()
            .blockType(BlockType.WORD)
            .text("Hello")
            .confidence(95.5f)
            .geometry(polygon)
            .build();
    Block world =
        Block.builder()
            .blockType(BlockType.WORD)
            .text("World")
            .confidence(42f)
            .geometry(
                Geometry.builder()
                    .boundingBox(
                        BoundingBox.builder()
                            .left(0.5f)
                            .top(0.6f)
                            .width(0.1f)
                            .height(0.05f)
                            .build())
                    .build())
            .build();
    when(textract.detectDocumentText(any(DetectDocumentTextRequest.class)))
        .thenReturn(DetectDocumentTextResponse.builder().blocks(line, hello, world).build());

    DetectionResult result = new TextDetectionClient(textract).detect(IMAGE);

    assertThat(result.words()).extracting(DetectedWord::text).containsExactly("Hello", "World");
    DetectedWord first = result.words().get(0);
    assertThat(first.confidence()).isCloseTo(0.955, within(1e-6));
    assertThat(first.boundingBox().topLeft().x()).isCloseTo(0.10, within(1e-6));
    assertThat(first.boundingBox().bottomRight().y()).isCloseTo(0.25, within(1e-6));
    DetectedWord second = result.words().get(1);
    assertThat(second.confidence()).isCloseTo(0.42, within(1e-6));
    assertThat(second.boundingBox().bottomRight().x()).isCloseTo(0.6, within(1e-6));
    assertThat(second.boundingBox().bottomRight().y()).isCloseTo(0.65, within(1e-6));

    ArgumentCaptor<DetectDocumentTextRequest> req =
        ArgumentCaptor.forClass(DetectDocumentTextRequest.class);
    verify(textract).detectDocumentText(req.capture());
    assertThat(req.getValue().document().s3Object().bucket()).isEqualTo("bucket");
    assertThat(req.getValue().document().s3Object().name()).isEqualTo("part3/1234-photo.png");
  }

  @Test
  void serviceErrorsPropagate() {
    when(textract.detectDocumentText(any(DetectDocumentTextRequest.class)))
        .thenThrow(TextractException.builder().message("throttled").build());

    assertThatThrownBy(() -> new TextDetectionClient(textract).detect(IMAGE))
        .isInstanceOf(TextractException.class);
  }

  private static Point point(float x, float y) {
    return Point.builder().x(x).y(y).build();
  }
}
