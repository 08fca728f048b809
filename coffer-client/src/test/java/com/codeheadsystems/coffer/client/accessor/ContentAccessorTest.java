package com.codeheadsystems.coffer.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.coffer.client.TestConfigs;
import com.codeheadsystems.coffer.client.exceptions.HttpApiException;
import com.codeheadsystems.coffer.client.exceptions.StorageBackendException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContentAccessorTest {

  private static final URI URL = URI.create("https://s3.example.com/bucket/object?signature=abc");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<byte[]> httpResponse;

  private ContentAccessor accessor;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    accessor = new ContentAccessor(new RetryingHttpExecutor(httpClient, objectMapper,
        new ErrorResponseParser(objectMapper, new XmlMapper()), TestConfigs.config(), d -> { }));
  }

  @ParameterizedTest
  @CsvSource({
      "0, 5, 5, bytes 0-5/5",
      "0, 10, 25, bytes 0-10/25",
      "10, 10, 25, bytes 10-20/25",
      "20, 5, 25, bytes 20-25/25",
      "5, 5, 12, bytes 5-10/12",
      "10, 2, 12, bytes 10-12/12",
      "0, 0, 0, bytes 0-0/0"
  })
  void contentRange_endIsOffsetPlusLengthCappedAtTotal(final long start, final long length, final long total,
                                                       final String expected) {
    assertThat(ContentAccessor.contentRange(start, length, total)).isEqualTo(expected);
  }

  @Test
  void totalFromContentRange_parsesTotal() {
    assertThat(ContentAccessor.totalFromContentRange("bytes 0-0/4711")).contains(4711L);
    assertThat(ContentAccessor.totalFromContentRange("bytes 0-0/*")).isEmpty();
    assertThat(ContentAccessor.totalFromContentRange("garbage")).isEmpty();
  }

  @Test
  void putPart_returnsEtagWithoutQuotes() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.headers()).thenReturn(headers(Map.of("ETag", List.of("\"9b2cf535f27731c974343645a3985328\""))));

    assertThat(accessor.putPart(URL, new byte[] {1, 2, 3})).isEqualTo("9b2cf535f27731c974343645a3985328");
  }

  @Test
  @SuppressWarnings("unchecked")
  void postChunk_sendsContentRange() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(201);

    accessor.postChunk(URL, new byte[4], 8, 12);

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    assertThat(captor.getValue().headers().firstValue("Content-Range")).contains("bytes 8-12/12");
    assertThat(captor.getValue().method()).isEqualTo("POST");
  }

  @Test
  void getRange_s3Error_throwsStorageBackendException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(403);
    when(httpResponse.body()).thenReturn(("<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
        + "<Error><Code>AccessDenied</Code><Message>Request has expired</Message>"
        + "<RequestId>R1</RequestId><HostId>H1</HostId></Error>").getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> accessor.getRange(URL, 0, 9))
        .isInstanceOfSatisfying(StorageBackendException.class, e -> {
          assertThat(e.isForbidden()).isTrue();
          assertThat(e.error().code()).isEqualTo("AccessDenied");
        });
  }

  @Test
  void getRange_jsonError_throwsHttpApiException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(404);
    when(httpResponse.body()).thenReturn("{\"code\":404,\"message\":\"File not found\"}"
        .getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> accessor.getRange(URL, 0, 9))
        .isInstanceOfSatisfying(HttpApiException.class, e -> assertThat(e.isNotFound()).isTrue());
  }

  @Test
  void fetchTotalSize_readsTotalFromContentRange() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(206);
    when(httpResponse.headers()).thenReturn(headers(Map.of("Content-Range", List.of("bytes 0-0/1024"))));

    assertThat(accessor.fetchTotalSize(URL)).contains(1024L);
  }

  private static HttpHeaders headers(final Map<String, List<String>> values) {
    return HttpHeaders.of(values, (name, value) -> true);
  }
}
