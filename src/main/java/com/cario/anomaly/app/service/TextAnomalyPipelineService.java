package com.cario.anomaly.app.service;

import com.cario.anomaly.app.config.PipelineProperties;
import com.cario.anomaly.app.model.AccessLink;
import com.cario.anomaly.app.model.AnomalyRequest;
import com.cario.anomaly.app.model.DetectionResult;
import com.cario.anomaly.app.model.FetchedImage;
import com.cario.anomaly.app.model.LinkResult;
import com.cario.anomaly.app.model.PipelineResult;
import com.cario.anomaly.app.model.PipelineStage;
import com.cario.anomaly.app.model.StageResult;
import com.cario.anomaly.app.model.StoredObjectRef;
import com.cario.anomaly.app.model.report.DocumentGenerationRequest;
import com.cario.anomaly.app.model.report.DocumentGenerationResponse;
import com.cario.anomaly.app.model.report.ReportData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;

/**
 * TextAnomalyPipelineService
 *
 * <ol>
 *   <li>Parse the request and download the image from its URL.
 *   <li>Reject anything that is not a jpeg or png.
 *   <li>Store the image under a unique key and run text detection on it.
 *   <li>If every word meets the confidence threshold, stop with {@link PipelineResult.NoAnomaly}.
 *   <li>Otherwise generate the PDF report and return a one-off download link for it.
 * </ol>
 *
 * Recognized stage failures come back as {@link PipelineResult.Failure}. Anything else (text
 * detection errors, undecodable responses) is logged and rethrown.
 */
@Log4j2
public class TextAnomalyPipelineService {

  public static final String NO_DATA_MESSAGE = "No data provided";

  private final RemoteImageFetcher fetcher;
  private final StorageGateway storage;
  private final TextDetectionClient detection;
  private final AnomalyEvaluator evaluator;
  private final ReportPayloadBuilder payloadBuilder;
  private final ReportGeneratorInvoker reportGenerator;
  private final ObjectMapper mapper;
  private final Duration linkExpiry;

  public TextAnomalyPipelineService(
      RemoteImageFetcher fetcher,
      StorageGateway storage,
      TextDetectionClient detection,
      AnomalyEvaluator evaluator,
      ReportPayloadBuilder payloadBuilder,
      ReportGeneratorInvoker reportGenerator,
      ObjectMapper mapper,
      PipelineProperties properties) {
    this.fetcher = Objects.requireNonNull(fetcher);
    this.storage = Objects.requireNonNull(storage);
    this.detection = Objects.requireNonNull(detection);
    this.evaluator = Objects.requireNonNull(evaluator);
    this.payloadBuilder = Objects.requireNonNull(payloadBuilder);
    this.reportGenerator = Objects.requireNonNull(reportGenerator);
    this.mapper = Objects.requireNonNull(mapper);
    this.linkExpiry = Objects.requireNonNull(properties.linkExpiry());
  }

  /** Runs the pipeline on a raw JSON request body; null or blank means no data. */
  public PipelineResult process(String rawBody) {
    String reqId = UUID.randomUUID().toString();
    StageResult<AnomalyRequest> parsed = parseBody(rawBody);
    if (parsed instanceof StageResult.Failed<AnomalyRequest> failed) {
      return failure(reqId, failed);
    }
    return run(reqId, parsed.value());
  }

  public PipelineResult process(AnomalyRequest request) {
    return run(UUID.randomUUID().toString(), request);
  }

  private PipelineResult run(String reqId, AnomalyRequest request) {
    long t0 = System.nanoTime();
    PipelineStage stage = PipelineStage.INPUT;

    try {
      StageResult<URI> input = parseUrl(request);
      if (input instanceof StageResult.Failed<URI> failed) {
        return failure(reqId, failed);
      }
      URI url = input.value();
      log.info("pipeline.start id={} url={}", reqId, url);

      // 1) Fetch and validate the image
      stage = PipelineStage.FETCH;
      FetchedImage image = fetcher.fetch(url);
      if (!image.isOk()) {
        return failure(
            reqId,
            stage,
            "Failed to retrieve the file from '"
                + url
                + "'. Status code: "
                + image.getStatusCode());
      }

      stage = PipelineStage.CONTENT_TYPE;
      if (!image.getContentType().isSupported()) {
        return failure(reqId, stage, "Failed to retrieve a jpeg or png image from '" + url + "'.");
      }

      // 2) Store it
      stage = PipelineStage.STORE;
      StoredObjectRef stored = storage.ref(storage.newImageObjectKey(image.getFileName()));
      int putStatus = storage.put(image.getBytes(), image.getContentType(), stored.objectKey());
      if (putStatus != 200) {
        return failure(
            reqId,
            stage,
            "Image "
                + stored.objectKey()
                + " storing in Bucket "
                + stored.bucket()
                + " failed with status code "
                + putStatus
                + ".");
      }
      log.info("pipeline.stored id={} s3={}", reqId, stored.s3Uri());

      // 3) Detect text; service errors propagate
      stage = PipelineStage.DETECT;
      DetectionResult words = detection.detect(stored);

      // 4) Short-circuit when nothing is anomalous
      stage = PipelineStage.EVALUATE;
      if (evaluator.isClear(words)) {
        String message =
            String.format(
                "All Words are clear in Image: \"%s\" from Bucket: \"%s\" in Namespace: \"%s\"",
                stored.objectKey(), stored.bucket(), stored.namespace());
        log.info(
            "pipeline.clear id={} words={} threshold={} durationMs={}",
            reqId,
            words.size(),
            evaluator.threshold(),
            elapsedMs(t0));
        return new PipelineResult.NoAnomaly(message);
      }
      log.info(
          "pipeline.anomalies id={} image={} words={}", reqId, stored.objectKey(), words.size());

      // 5) Generate the report
      stage = PipelineStage.REPORT_BUILD;
      ReportData data = payloadBuilder.build(words, stored);
      DocumentGenerationRequest docRequest = payloadBuilder.buildRequest(data, stored);

      stage = PipelineStage.REPORT_GENERATION;
      StageResult<DocumentGenerationResponse> generated = reportGenerator.generate(docRequest);
      if (generated instanceof StageResult.Failed<DocumentGenerationResponse> failed) {
        return failure(reqId, failed);
      }

      // 6) Link to the report
      stage = PipelineStage.ACCESS_LINK;
      String reportKey = ReportPayloadBuilder.reportObjectKey(stored.objectKey());
      LinkResult link = storage.createReadOnlyLink(reportKey, linkExpiry);
      if (link.statusCode() != 200) {
        return failure(
            reqId, stage, "Report link generation error. Status code: " + link.statusCode());
      }
      if (link.link() == null) {
        return failure(reqId, stage, "Report link generation returned no URL for " + reportKey);
      }

      AccessLink accessLink = link.link();
      log.info(
          "pipeline.success id={} report={} expiresAt={} durationMs={}",
          reqId,
          reportKey,
          accessLink.expiresAt(),
          elapsedMs(t0));
      return new PipelineResult.ReportReady(url.toString(), accessLink);

    } catch (RuntimeException e) {
      log.error(
          "pipeline.error id={} stage={} durationMs={} msg={}",
          reqId,
          stage,
          elapsedMs(t0),
          e.getMessage(),
          e);
      throw e;
    }
  }

  // ------------------ Stage helpers ------------------

  private StageResult<AnomalyRequest> parseBody(String rawBody) {
    if (rawBody == null || rawBody.isBlank()) {
      return StageResult.failed(PipelineStage.INPUT, NO_DATA_MESSAGE);
    }
    try {
      AnomalyRequest request = mapper.readValue(rawBody, AnomalyRequest.class);
      if (request == null) {
        return StageResult.failed(PipelineStage.INPUT, NO_DATA_MESSAGE);
      }
      return StageResult.success(request);
    } catch (JsonProcessingException e) {
      return StageResult.failed(
          PipelineStage.INPUT, "Invalid request payload: " + e.getOriginalMessage());
    }
  }

  static StageResult<URI> parseUrl(AnomalyRequest request) {
    if (request == null) {
      return StageResult.failed(PipelineStage.INPUT, NO_DATA_MESSAGE);
    }
    String raw = request.getUrl();
    if (raw == null || raw.isBlank()) {
      return StageResult.failed(PipelineStage.INPUT, "Missing 'url' in request payload");
    }
    try {
      URI uri = new URI(raw.trim());
      String scheme = uri.getScheme();
      if (!uri.isAbsolute()
          || uri.getHost() == null
          || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
        return StageResult.failed(
            PipelineStage.INPUT,
            "Invalid image URL '" + raw + "': must be an absolute http(s) URL");
      }
      return StageResult.success(uri);
    } catch (URISyntaxException e) {
      return StageResult.failed(
          PipelineStage.INPUT, "Invalid image URL '" + raw + "': " + e.getReason());
    }
  }

  private static PipelineResult failure(String reqId, StageResult.Failed<?> failed) {
    return failure(reqId, failed.stage(), failed.message());
  }

  private static PipelineResult failure(String reqId, PipelineStage stage, String message) {
    log.error("pipeline.failure id={} stage={} msg={}", reqId, stage, message);
    return new PipelineResult.Failure(message, stage);
  }

  private static long elapsedMs(long t0) {
    return (System.nanoTime() - t0) / 1_000_000;
  }
}
