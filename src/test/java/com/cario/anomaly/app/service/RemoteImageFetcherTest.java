package com.cario.anomaly.app.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.cario.anomaly.app.model.FetchedImage;
import com.cario.anomaly.app.model.ImageContentType;
import java.net.URI;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class RemoteImageFetcherTest {

  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

  private RemoteImageFetcher fetcherReturning(ClientResponse response) {
    return fetcherReturning(response, DataSize.ofMegabytes(10));
  }

  private RemoteImageFetcher fetcherReturning(ClientResponse response, DataSize maxImageSize) {
    WebClient client =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(response);
                })
            .build();
    return new RemoteImageFetcher(client, maxImageSize);
  }

  @Test
  void returnsBodyFileNameAndContentType() {
    byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
    ClientResponse ok =
        ClientResponse.create(HttpStatus.OK)
            .body(Flux.<DataBuffer>just(DefaultDataBufferFactory.sharedInstance.wrap(png)))
            .build();

    FetchedImage image =
        fetcherReturning(ok).fetch(URI.create("https://images.example.com/samples/photo.png"));

    assertThat(image.isOk()).isTrue();
    assertThat(image.getBytes()).containsExactly(png);
    assertThat(image.getFileName()).isEqualTo("photo.png");
    assertThat(image.getContentType()).isEqualTo(ImageContentType.PNG);

    ClientRequest sent = lastRequest.get();
    assertThat(sent.method()).isEqualTo(HttpMethod.GET);
    assertThat(sent.headers().getFirst(HttpHeaders.USER_AGENT))
        .isEqualTo(RemoteImageFetcher.USER_AGENT);
    assertThat(sent.headers().getFirst(HttpHeaders.ACCEPT)).isEqualTo("*/*");
  }

  @Test
  void nonSuccessStatusIsReturnedNotThrown() {
    ClientResponse notFound = ClientResponse.create(HttpStatus.NOT_FOUND).build();

    FetchedImage image =
        fetcherReturning(notFound).fetch(URI.create("https://images.example.com/missing.jpg"));

    assertThat(image.isOk()).isFalse();
    assertThat(image.getStatusCode()).isEqualTo(404);
    assertThat(image.getBytes()).isEmpty();
    assertThat(image.getContentType()).isEqualTo(ImageContentType.JPEG);
  }

  @Test
  void imageLargerThanCodecDefaultIsReadWhole() {
    byte[] large = new byte[300 * 1024];
    Arrays.fill(large, (byte) 7);
    ClientResponse ok =
        ClientResponse.create(HttpStatus.OK)
            .body(
                Flux.<DataBuffer>just(
                    DefaultDataBufferFactory.sharedInstance.wrap(Arrays.copyOf(large, 100 * 1024)),
                    DefaultDataBufferFactory.sharedInstance.wrap(
                        Arrays.copyOfRange(large, 100 * 1024, large.length))))
            .build();

    FetchedImage image = fetcherReturning(ok).fetch(URI.create("https://h.example.com/photo.png"));

    assertThat(image.isOk()).isTrue();
    assertThat(image.getBytes()).hasSize(large.length).isEqualTo(large);
    assertThat(image.getContentType()).isEqualTo(ImageContentType.PNG);
  }

  @Test
  void imageAboveConfiguredMaximumIsPayloadTooLarge() {
    ClientResponse ok =
        ClientResponse.create(HttpStatus.OK)
            .body(
                Flux.<DataBuffer>just(DefaultDataBufferFactory.sharedInstance.wrap(new byte[2048])))
            .build();

    FetchedImage image =
        fetcherReturning(ok, DataSize.ofKilobytes(1))
            .fetch(URI.create("https://h.example.com/photo.jpg"));

    assertThat(image.isOk()).isFalse();
    assertThat(image.getStatusCode()).isEqualTo(413);
    assertThat(image.getBytes()).isEmpty();
  }

  @Test
  void fileNameIgnoresQueryString() {
    assertThat(RemoteImageFetcher.fileName(URI.create("https://h.example.com/a/b/pic.jpg?x=1")))
        .isEqualTo("pic.jpg");
    assertThat(RemoteImageFetcher.fileName(URI.create("https://h.example.com"))).isEmpty();
  }
}
