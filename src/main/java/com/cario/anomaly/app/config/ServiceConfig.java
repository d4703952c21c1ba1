package com.cario.anomaly.app.config;

import com.cario.anomaly.app.service.AnomalyEvaluator;
import com.cario.anomaly.app.service.ApiKeyAuthorizerService;
import com.cario.anomaly.app.service.RemoteImageFetcher;
import com.cario.anomaly.app.service.ReportGeneratorInvoker;
import com.cario.anomaly.app.service.ReportPayloadBuilder;
import com.cario.anomaly.app.service.StorageGateway;
import com.cario.anomaly.app.service.TextAnomalyPipelineService;
import com.cario.anomaly.app.service.TextDetectionClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final TextractClient textractClient;
  private final LambdaClient lambdaClient;
  private final PipelineProperties pipelineProperties;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // -------------------
  // Pipeline stages
  // -------------------

  @Bean
  public RemoteImageFetcher remoteImageFetcher(WebClient.Builder builder) {
    return new RemoteImageFetcher(builder.build(), pipelineProperties.maxImageSize());
  }

  @Bean
  public StorageGateway storageGateway(Clock clock) {
    return new StorageGateway(s3Client, s3Presigner, pipelineProperties, clock);
  }

  @Bean
  public TextDetectionClient textDetectionClient() {
    return new TextDetectionClient(textractClient);
  }

  @Bean
  public AnomalyEvaluator anomalyEvaluator() {
    return new AnomalyEvaluator(pipelineProperties.confidenceThreshold());
  }

  @Bean
  public ReportPayloadBuilder reportPayloadBuilder() {
    return new ReportPayloadBuilder(pipelineProperties);
  }

  @Bean
  public ReportGeneratorInvoker reportGeneratorInvoker(ObjectMapper objectMapper) {
    return new ReportGeneratorInvoker(
        lambdaClient, objectMapper, pipelineProperties.reportFunctionName());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public TextAnomalyPipelineService textAnomalyPipelineService(
      RemoteImageFetcher fetcher,
      StorageGateway storage,
      TextDetectionClient detection,
      AnomalyEvaluator evaluator,
      ReportPayloadBuilder payloadBuilder,
      ReportGeneratorInvoker reportGenerator,
      ObjectMapper objectMapper) {
    return new TextAnomalyPipelineService(
        fetcher,
        storage,
        detection,
        evaluator,
        payloadBuilder,
        reportGenerator,
        objectMapper,
        pipelineProperties);
  }

  @Bean
  public ApiKeyAuthorizerService apiKeyAuthorizerService(
      ApiKeyProperties apiKeyProperties, ObjectMapper objectMapper) {
    return new ApiKeyAuthorizerService(apiKeyProperties.getApiKeys(), objectMapper);
  }
}
