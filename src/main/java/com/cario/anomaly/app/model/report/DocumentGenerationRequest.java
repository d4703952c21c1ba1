package com.cario.anomaly.app.model.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Payload sent to the document generation function: inline template data plus storage references
 * for the template, the fonts and the PDF output.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentGenerationRequest {

  public static final String SOURCE_OBJECT_STORAGE = "OBJECT_STORAGE";
  public static final String DOCX_CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
  public static final String PDF_CONTENT_TYPE = "application/pdf";

  @Builder.Default String requestType = "SINGLE";
  @Builder.Default TagSyntax tagSyntax = new TagSyntax("{", "}");
  InlineData data;
  StorageAsset template;
  StorageAsset output;
  @Builder.Default String locale = "en";
  @Builder.Default String timezone = "UTC";
  StorageAsset fonts;

  public record TagSyntax(String openDelimiter, String closeDelimiter) {}

  public record InlineData(String source, ReportData content) {
    public static InlineData of(ReportData content) {
      return new InlineData("INLINE", content);
    }
  }

  /** An object in storage, used as an input ({@code source}) or an output ({@code target}). */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record StorageAsset(
      String source,
      String target,
      String namespace,
      String bucketName,
      String objectName,
      String contentType) {

    public static StorageAsset input(
        String namespace, String bucket, String objectName, String contentType) {
      return new StorageAsset(
          SOURCE_OBJECT_STORAGE, null, namespace, bucket, objectName, contentType);
    }

    public static StorageAsset output(
        String namespace, String bucket, String objectName, String contentType) {
      return new StorageAsset(
          null, SOURCE_OBJECT_STORAGE, namespace, bucket, objectName, contentType);
    }
  }
}
