package com.codeheadsystems.coffer.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.coffer.client.exceptions.AuthenticationException;
import com.codeheadsystems.coffer.client.exceptions.HttpApiException;
import com.codeheadsystems.coffer.client.exceptions.StorageBackendException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ErrorResponseParserTest {

  private final ErrorResponseParser parser = new ErrorResponseParser(new ObjectMapper(), new XmlMapper());

  @ParameterizedTest
  @ValueSource(strings = {"null", " null ", "", "[1,2]", "\"oops\"", "{not json"})
  void apiError_unusableBody_fallsBackToStatus(final String body) {
    HttpApiException e = parser.apiError(502, body);

    assertThat(e.statusCode()).isEqualTo(502);
    assertThat(e.error().debugInfo()).isEqualTo(ErrorResponseParser.PARSE_FAILURE);
  }

  @Test
  void apiError_bodyCodeDiffers_statusWins() {
    HttpApiException e = parser.apiError(404, "{\"code\":400,\"message\":\"Not found\",\"errorCode\":-40000}");

    assertThat(e.statusCode()).isEqualTo(404);
    assertThat(e.error().message()).isEqualTo("Not found");
    assertThat(e.error().errorCode()).isEqualTo(-40000);
  }

  @Test
  void oauthError_nullBody_fallsBackToApiError() {
    assertThat(parser.oauthError(400, "null"))
        .isInstanceOfSatisfying(HttpApiException.class, e -> {
          assertThat(e.statusCode()).isEqualTo(400);
          assertThat(e.error().debugInfo()).isEqualTo(ErrorResponseParser.PARSE_FAILURE);
        });
  }

  @Test
  void oauthError_oauthBody_isAuthenticationException() {
    assertThat(parser.oauthError(400, "{\"error\":\"invalid_grant\",\"error_description\":\"expired\"}"))
        .isInstanceOfSatisfying(AuthenticationException.class,
            e -> assertThat(e.error().error()).isEqualTo("invalid_grant"));
  }

  @Test
  void contentError_nullBody_isApiFallback() {
    assertThat(parser.contentError(500, "null"))
        .isInstanceOfSatisfying(HttpApiException.class,
            e -> assertThat(e.error().debugInfo()).isEqualTo(ErrorResponseParser.PARSE_FAILURE));
  }

  @Test
  void contentError_xmlBody_isStorageError() {
    assertThat(parser.contentError(403, "<Error><Code>AccessDenied</Code><Message>expired</Message></Error>"))
        .isInstanceOfSatisfying(StorageBackendException.class, e -> {
          assertThat(e.isForbidden()).isTrue();
          assertThat(e.error().code()).isEqualTo("AccessDenied");
        });
  }
}
