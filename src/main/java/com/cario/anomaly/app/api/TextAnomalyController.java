package com.cario.anomaly.app.api;

import com.cario.anomaly.app.model.PipelineResult;
import com.cario.anomaly.app.service.TextAnomalyPipelineService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Log4j2
@RestController
@RequestMapping("/anomaly")
@RequiredArgsConstructor
public class TextAnomalyController {

  private final TextAnomalyPipelineService pipelineService;

  // ------------------------------------------------------------
  // /anomaly/detect
  // ------------------------------------------------------------
  @PostMapping(path = "/detect", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> detect(@RequestBody(required = false) String body) {
    log.info("anomaly.detect bodyLength={}", body == null ? 0 : body.length());
    return toResponse(pipelineService.process(body));
  }

  // ============================================================
  // Helpers
  // ============================================================
  static ResponseEntity<Map<String, Object>> toResponse(PipelineResult result) {
    if (result instanceof PipelineResult.ReportReady ready) {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("inputUrl", ready.inputUrl());
      body.put("reportWithAnomalies", ready.accessLink().url());
      return ResponseEntity.ok(body);
    }
    if (result instanceof PipelineResult.NoAnomaly clear) {
      return ResponseEntity.status(HttpStatus.NO_CONTENT).body(message(clear.message()));
    }
    PipelineResult.Failure failure = (PipelineResult.Failure) result;
    return ResponseEntity.badRequest().body(message(failure.message()));
  }

  private static Map<String, Object> message(String message) {
    return Map.of("message", message);
  }
}
