package com.codeheadsystems.coffer.model.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class OAuth2TokenResponseTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void parse_tokenResponse() throws Exception {
    String json = "{\"access_token\":\"acc\",\"refresh_token\":\"ref\",\"token_type\":\"bearer\","
        + "\"expires_in\":28800,\"scope\":\"all\"}";

    OAuth2TokenResponse response = mapper.readValue(json, OAuth2TokenResponse.class);

    assertThat(response.accessToken()).isEqualTo("acc");
    assertThat(response.refreshToken()).isEqualTo("ref");
    assertThat(response.expiresIn()).isEqualTo(28800L);
    assertThat(response.expiresInInactive()).isNull();
  }

  @Test
  void toString_hidesTokens() {
    OAuth2TokenResponse response = new OAuth2TokenResponse("acc", "ref", "bearer", 60, null, "all");

    assertThat(response.toString()).doesNotContain("acc").doesNotContain("ref");
  }

  @Test
  void errorResponse_parsesDescription() throws Exception {
    OAuth2ErrorResponse error = mapper.readValue(
        "{\"error\":\"invalid_grant\",\"error_description\":\"Bad credentials\"}",
        OAuth2ErrorResponse.class);

    assertThat(error.toString()).isEqualTo("invalid_grant (Bad credentials)");
  }
}
