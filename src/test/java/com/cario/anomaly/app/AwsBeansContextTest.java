package com.cario.anomaly.app;

import static org.assertj.core.api.Assertions.assertThat;

import com.cario.anomaly.app.config.PipelineProperties;
import com.cario.anomaly.app.service.AnomalyEvaluator;
import com.cario.anomaly.app.service.TextAnomalyPipelineService;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

@SpringBootTest
@ActiveProfiles("test")
class AwsBeansContextTest {

  @MockBean private S3Client s3Client;
  @MockBean private S3Presigner s3Presigner;
  @MockBean private TextractClient textractClient;
  @MockBean private LambdaClient lambdaClient;

  @Autowired private PipelineProperties properties;
  @Autowired private AnomalyEvaluator evaluator;
  @Autowired private TextAnomalyPipelineService pipelineService;

  @Test
  void pipelineIsWiredFromConfiguration() {
    assertThat(pipelineService).isNotNull();
    assertThat(properties.bucket()).isEqualTo("test-bucket");
    assertThat(properties.namespace()).isEqualTo("test-namespace");
    assertThat(properties.linkExpiry()).isEqualTo(Duration.ofHours(1));
    assertThat(properties.normalizedPrefix()).isEqualTo("part3");
    assertThat(evaluator.threshold()).isEqualTo(0.90);
  }
}
