package com.cario.anomaly.app.model;

/** Stages of the anomaly pipeline, in execution order. */
public enum PipelineStage {
  INPUT,
  FETCH,
  CONTENT_TYPE,
  STORE,
  DETECT,
  EVALUATE,
  REPORT_BUILD,
  REPORT_GENERATION,
  ACCESS_LINK
}
