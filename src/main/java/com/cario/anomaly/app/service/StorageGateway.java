package com.cario.anomaly.app.service;

import com.cario.anomaly.app.config.PipelineProperties;
import com.cario.anomaly.app.model.AccessLink;
import com.cario.anomaly.app.model.ImageContentType;
import com.cario.anomaly.app.model.LinkResult;
import com.cario.anomaly.app.model.StoredObjectRef;
import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * S3 access for the pipeline: stores source images and mints read-only download links.
 *
 * <p>Storage errors are reported as status codes rather than exceptions so the pipeline can turn
 * them into structured failures.
 */
@Log4j2
public class StorageGateway {

  private final S3Client s3;
  private final S3Presigner presigner;
  private final Clock clock;
  private final String namespace;
  private final String bucket;
  private final String prefix;

  public StorageGateway(
      S3Client s3, S3Presigner presigner, PipelineProperties properties, Clock clock) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.presigner = Objects.requireNonNull(presigner, "S3Presigner must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.namespace = properties.namespace();
    this.bucket = properties.bucket();
    this.prefix = properties.normalizedPrefix();
  }

  public String bucket() {
    return bucket;
  }

  /** Unique key for an uploaded image: {@code <prefix>/<uuid>-<fileName>}. */
  public String newImageObjectKey(String fileName) {
    String base = UUID.randomUUID() + "-" + (fileName == null ? "" : fileName);
    return prefix.isEmpty() ? base : prefix + "/" + base;
  }

  public StoredObjectRef ref(String objectKey) {
    return new StoredObjectRef(namespace, bucket, objectKey);
  }

  /**
   * Upload bytes under the given key.
   *
   * @return HTTP status reported by S3; 200 on success
   */
  public int put(byte[] bytes, ImageContentType contentType, String objectKey) {
    PutObjectRequest req =
        PutObjectRequest.builder()
            .bucket(bucket)
            .key(objectKey)
            .contentType(contentType.mimeType())
            .contentLength((long) bytes.length)
            .build();
    try {
      PutObjectResponse resp = s3.putObject(req, RequestBody.fromBytes(bytes));
      int status = resp.sdkHttpResponse().statusCode();
      log.info(
          "s3.put bucket={} key={} size={} status={} eTag={}",
          bucket,
          objectKey,
          bytes.length,
          status,
          resp.eTag());
      return status;
    } catch (S3Exception e) {
      log.warn(
          "s3.put error bucket={} key={} status={} msg={}",
          bucket,
          objectKey,
          e.statusCode(),
          errorMessage(e));
      return e.statusCode();
    }
  }

  /**
   * Creates a read-only, time-limited GET link for a single object. The object must exist; the
   * returned status is that of the existence check.
   */
  public LinkResult createReadOnlyLink(String objectKey, Duration expiry) {
    int status;
    try {
      HeadObjectResponse head =
          s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(objectKey).build());
      status = head.sdkHttpResponse().statusCode();
    } catch (S3Exception e) {
      log.warn(
          "s3.head error bucket={} key={} status={} msg={}",
          bucket,
          objectKey,
          e.statusCode(),
          errorMessage(e));
      return new LinkResult(e.statusCode(), null);
    }
    if (status != 200) {
      return new LinkResult(status, null);
    }

    Instant expiresAt = clock.instant().plus(expiry);
    PresignedGetObjectRequest presigned =
        presigner.presignGetObject(
            GetObjectPresignRequest.builder()
                .signatureDuration(expiry)
                .getObjectRequest(
                    GetObjectRequest.builder().bucket(bucket).key(objectKey).build())
                .build());

    URL url = presigned == null ? null : presigned.url();
    if (url == null) {
      log.warn("s3.presign produced no url bucket={} key={}", bucket, objectKey);
      return new LinkResult(status, null);
    }
    log.info("s3.presign bucket={} key={} expiresAt={}", bucket, objectKey, expiresAt);
    return new LinkResult(status, new AccessLink(url.toString(), expiresAt));
  }

  private static String errorMessage(S3Exception e) {
    return e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
  }
}
