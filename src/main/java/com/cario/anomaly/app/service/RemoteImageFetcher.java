package com.cario.anomaly.app.service;

import com.cario.anomaly.app.model.FetchedImage;
import com.cario.anomaly.app.model.ImageContentType;
import java.net.URI;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Downloads an image into memory. Any HTTP status is returned to the caller as-is; there are no
 * retries.
 *
 * <p>The body is joined from raw buffers under {@code maxImageSize}, independent of the codec
 * in-memory limit. A larger body comes back as {@code 413} with no bytes.
 */
@Log4j2
public class RemoteImageFetcher {

  static final String USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko)"
          + " Chrome/87.0.4280.88 Safari/537.36";

  private final WebClient webClient;
  private final int maxImageBytes;

  public RemoteImageFetcher(WebClient webClient, DataSize maxImageSize) {
    this.webClient = Objects.requireNonNull(webClient, "webClient must not be null");
    Objects.requireNonNull(maxImageSize, "maxImageSize must not be null");
    this.maxImageBytes = (int) Math.min(maxImageSize.toBytes(), Integer.MAX_VALUE);
  }

  /** GET the URL and derive file name and content type from its last path segment. */
  public FetchedImage fetch(URI url) {
    String fileName = fileName(url);

    FetchedImage.FetchedImageBuilder result =
        webClient
            .get()
            .uri(url)
            .header(HttpHeaders.USER_AGENT, USER_AGENT)
            .header(HttpHeaders.ACCEPT, "*/*")
            .exchangeToMono(
                resp ->
                    DataBufferUtils.join(resp.bodyToFlux(DataBuffer.class), maxImageBytes)
                        .map(RemoteImageFetcher::toBytes)
                        .defaultIfEmpty(new byte[0])
                        .map(
                            body ->
                                FetchedImage.builder()
                                    .statusCode(resp.statusCode().value())
                                    .bytes(body))
                        .onErrorResume(
                            DataBufferLimitException.class,
                            e -> {
                              log.warn(
                                  "fetch.tooLarge url={} maxBytes={} msg={}",
                                  url,
                                  maxImageBytes,
                                  e.getMessage());
                              return Mono.just(
                                  FetchedImage.builder()
                                      .statusCode(HttpStatus.PAYLOAD_TOO_LARGE.value())
                                      .bytes(new byte[0]));
                            }))
            .switchIfEmpty(Mono.error(new IllegalStateException("No response from " + url)))
            .block();

    FetchedImage image =
        result.fileName(fileName).contentType(ImageContentType.fromFileName(fileName)).build();

    log.info(
        "fetch.done url={} status={} fileName={} contentType={} bytes={}",
        url,
        image.getStatusCode(),
        fileName,
        image.getContentType(),
        image.getBytes().length);
    return image;
  }

  private static byte[] toBytes(DataBuffer buffer) {
    try {
      byte[] bytes = new byte[buffer.readableByteCount()];
      buffer.read(bytes);
      return bytes;
    } finally {
      DataBufferUtils.release(buffer);
    }
  }

  static String fileName(URI url) {
    String path = url.getPath();
    if (path == null || path.isEmpty()) return "";
    int slash = path.lastIndexOf('/');
    return slash >= 0 ? path.substring(slash + 1) : path;
  }
}
