package com.timecard.auth_gateway.service.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import com.timecard.auth_gateway.model.MiniAppLoginResult;
import com.timecard.auth_gateway.service.AuthConfigurationException;
import com.timecard.auth_gateway.service.AuthProtocolException;
import com.timecard.auth_gateway.service.EmailNotAllowedException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

class MiniAppTokenExchangeServiceTest {

  private static final String USERINFO_URL = "https://www.worksapis.com/v1.0/users/me";

  @Test
  void exchangeIssuesSessionAndBridgeUrl() {
    final AdapterFixture fixture = AdapterFixture.create();
    fixture
        .server()
        .expect(requestTo(USERINFO_URL))
        .andExpect(header("Authorization", "Bearer sdk-token"))
        .andRespond(
            withSuccess(
                "{\"userId\":\"u-1\",\"email\":\"a@example.com\"}", MediaType.APPLICATION_JSON));

    final MiniAppLoginResult result = fixture.miniApp().exchange("sdk-token", "/reports?x=1");

    assertThat(result.redirectTarget()).isEqualTo("/reports?x=1");
    assertThat(result.sessionCookie().getName()).isEqualTo("session");
    assertThat(result.bridgeUrl()).startsWith("/auth/token?token=");
    final MultiValueMap<String, String> params =
        UriComponentsBuilder.fromUriString(result.bridgeUrl()).build().getQueryParams();
    assertThat(URLDecoder.decode(params.getFirst("redirect"), StandardCharsets.UTF_8))
        .isEqualTo("/reports?x=1");
    final Optional<Identity> bridged =
        fixture.sessionTokenService().verifyBridging(params.getFirst("token"));
    assertThat(bridged).map(Identity::sub).contains("u-1");
  }

  @Test
  void missingAccessTokenIsRejected() {
    final AdapterFixture fixture = AdapterFixture.create();

    assertThatThrownBy(() -> fixture.miniApp().exchange(" ", "/"))
        .isInstanceOf(AuthProtocolException.class)
        .extracting(ex -> ((AuthProtocolException) ex).reason())
        .isEqualTo(AuthProtocolException.Reason.MISSING_PARAMETERS);
  }

  @Test
  void disallowedEmailGetsNoBridgingToken() {
    final AdapterFixture fixture = AdapterFixture.create();
    fixture
        .server()
        .expect(requestTo(USERINFO_URL))
        .andRespond(withSuccess("{\"userId\":\"u-9\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.miniApp().exchange("sdk-token", "/"))
        .isInstanceOf(EmailNotAllowedException.class);
  }

  @Test
  void redeemIssuesFreshSessionForValidToken() {
    final AdapterFixture fixture = AdapterFixture.create();
    final String token =
        fixture
            .sessionTokenService()
            .mintBridging(
                Identity.unissued(
                    "u-1", "a@example.com", "A", IdentityProvider.LINEWORKS));

    assertThat(fixture.miniApp().redeem(token))
        .hasValueSatisfying(
            completion -> assertThat(completion.sessionCookie().getValue()).isNotBlank());
    // 使い回しは検知しない
    assertThat(fixture.miniApp().redeem(token)).isPresent();
  }

  @Test
  void redeemRejectsGarbageToken() {
    final AdapterFixture fixture = AdapterFixture.create();

    assertThat(fixture.miniApp().redeem("garbage")).isEmpty();
    assertThat(fixture.miniApp().redeem(null)).isEmpty();
  }

  @Test
  void woffIdIsRequired() {
    assertThat(AdapterFixture.create().miniApp().requireWoffId()).isEqualTo("woff-1");
    assertThatThrownBy(
            () ->
                AdapterFixture.create(
                        AdapterFixture.GOOGLE_CONFIG, AdapterFixture.LINEWORKS_CONFIG, null, "")
                    .miniApp()
                    .requireWoffId())
        .isInstanceOf(AuthConfigurationException.class);
  }
}
