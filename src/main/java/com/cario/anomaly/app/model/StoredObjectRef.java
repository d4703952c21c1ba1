package com.cario.anomaly.app.model;

/**
 * Coordinates of an object in the storage bucket.
 *
 * @param namespace logical storage namespace carried into report payloads
 * @param bucket bucket name
 * @param objectKey full object key, including the prefix
 */
public record StoredObjectRef(String namespace, String bucket, String objectKey) {

  public String s3Uri() {
    return "s3://" + bucket + "/" + objectKey;
  }
}
