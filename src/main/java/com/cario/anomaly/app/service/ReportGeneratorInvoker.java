package com.cario.anomaly.app.service;

import com.cario.anomaly.app.model.PipelineStage;
import com.cario.anomaly.app.model.StageResult;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest;
import com.cario.anomaly.app.model.report.DocumentGenerationResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;
import software.amazon.awssdk.services.lambda.model.LambdaException;

/**
 * Calls the document generation function synchronously.
 *
 * <p>Two statuses are checked: the invocation status must be 200 and the function's own {@code
 * code} must be 200. Only then was the PDF written.
 */
@Log4j2
public class ReportGeneratorInvoker {

  private final LambdaClient lambdaClient;
  private final ObjectMapper mapper;
  private final String functionName;

  public ReportGeneratorInvoker(
      LambdaClient lambdaClient, ObjectMapper mapper, String functionName) {
    this.lambdaClient = Objects.requireNonNull(lambdaClient, "lambdaClient must not be null");
    this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
  }

  public StageResult<DocumentGenerationResponse> generate(DocumentGenerationRequest request) {
    String payload;
    try {
      payload = mapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new RuntimeException("Failed to serialize document generation request", e);
    }

    int status;
    String body;
    String functionError = null;
    try {
      InvokeResponse resp =
          lambdaClient.invoke(
              InvokeRequest.builder()
                  .functionName(functionName)
                  .invocationType(InvocationType.REQUEST_RESPONSE)
                  .payload(SdkBytes.fromUtf8String(payload))
                  .build());
      status = resp.statusCode() == null ? 0 : resp.statusCode();
      body = resp.payload() == null ? "" : resp.payload().asUtf8String();
      functionError = resp.functionError();
      if (functionError != null) {
        log.warn("docgen.functionError fn={} error={} body={}", functionName, functionError, body);
      }
    } catch (LambdaException e) {
      log.warn(
          "docgen.invoke error fn={} status={} msg={}",
          functionName,
          e.statusCode(),
          e.getMessage());
      status = e.statusCode();
      body = null;
    }

    log.debug("docgen.response fn={} status={} body={}", functionName, status, body);

    if (status != 200) {
      return StageResult.failed(
          PipelineStage.REPORT_GENERATION,
          "Document generation invocation failed with status " + status + ".");
    }

    if (functionError != null) {
      return StageResult.failed(
          PipelineStage.REPORT_GENERATION,
          "Document generation failure: '" + functionError + "'. See Application Log");
    }

    DocumentGenerationResponse decoded;
    try {
      decoded = mapper.readValue(body, DocumentGenerationResponse.class);
    } catch (JsonProcessingException e) {
      throw new RuntimeException("Failed to decode document generation response", e);
    }

    if (!decoded.isSuccess()) {
      return StageResult.failed(
          PipelineStage.REPORT_GENERATION,
          "Document generation failure: '" + decoded.code() + "'. See Application Log");
    }

    log.info("docgen.ok fn={} output={}", functionName, request.getOutput().objectName());
    return StageResult.success(decoded);
  }
}
