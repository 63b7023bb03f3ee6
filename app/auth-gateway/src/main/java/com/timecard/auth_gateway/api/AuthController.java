/*
 * どこで: app/auth-gateway/src/main/java/com/timecard/auth_gateway/api/AuthController.java
 * 何を: ログイン開始/コールバック/アプリ内ログイン/一時トークン引き換え/ログアウト API を提供
 * なぜ: 認証フローの入口を 1 つのコントローラに集約するため
 */
package com.timecard.auth_gateway.api;

import com.timecard.auth_gateway.api.request.MiniAppTokenRequest;
import com.timecard.auth_gateway.api.response.AuthCheckResponse;
import com.timecard.auth_gateway.api.response.LoginOptionsResponse;
import com.timecard.auth_gateway.api.response.MiniAppLoginResponse;
import com.timecard.auth_gateway.api.response.MiniAppSessionResponse;
import com.timecard.auth_gateway.api.response.ProviderLoginOption;
import com.timecard.auth_gateway.model.CallbackRequest;
import com.timecard.auth_gateway.model.CallbackResult;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.LoginCompletion;
import com.timecard.auth_gateway.model.LoginRedirect;
import com.timecard.auth_gateway.model.MiniAppLoginResult;
import com.timecard.auth_gateway.service.AuthGateway;
import com.timecard.auth_gateway.service.RedirectTargets;
import com.timecard.auth_gateway.service.SessionTokenService;
import com.timecard.auth_gateway.service.provider.MiniAppTokenExchangeService;
import com.timecard.auth_gateway.service.provider.ProviderAdapter;
import com.timecard.auth_gateway.service.provider.ProviderAdapterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
public class AuthController {

  private final ProviderAdapterRegistry providerAdapterRegistry;
  private final MiniAppTokenExchangeService miniAppTokenExchangeService;
  private final SessionTokenService sessionTokenService;

  public AuthController(
      ProviderAdapterRegistry providerAdapterRegistry,
      MiniAppTokenExchangeService miniAppTokenExchangeService,
      SessionTokenService sessionTokenService) {
    this.providerAdapterRegistry = providerAdapterRegistry;
    this.miniAppTokenExchangeService = miniAppTokenExchangeService;
    this.sessionTokenService = sessionTokenService;
  }

  /**
   * 役割:
   * - ログイン画面が並べる選択肢を返す。
   *
   * 期待動作:
   * - 各プロバイダの開始 URL に遷移先を引き継ぐ。
   * - 認証状態は見ない。
   */
  @GetMapping("/login")
  public ResponseEntity<LoginOptionsResponse> loginOptions(
      @RequestParam(name = "redirect", required = false) String redirect) {
    final String target = RedirectTargets.sanitize(redirect);
    final List<ProviderLoginOption> options =
        providerAdapterRegistry.all().stream()
            .map(
                adapter ->
                    new ProviderLoginOption(
                        adapter.pathId(), withRedirect("/login/" + adapter.pathId(), target)))
            .toList();
    return ResponseEntity.ok(
        new LoginOptionsResponse(target, options, withRedirect("/login/woff", target)));
  }

  @GetMapping("/login/woff")
  public ResponseEntity<MiniAppLoginResponse> miniAppLogin() {
    return ResponseEntity.ok(
        new MiniAppLoginResponse(
            miniAppTokenExchangeService.requireWoffId(),
            MiniAppTokenExchangeService.CALLBACK_PATH));
  }

  /**
   * 役割:
   * - 指定プロバイダの認可画面へ送り出す。
   *
   * 期待動作:
   * - 302 と同時に state Cookie を発行する。
   * - 未知のプロバイダは 404。
   */
  @GetMapping("/login/{provider}")
  public ResponseEntity<Void> startLogin(
      @PathVariable("provider") String provider,
      @RequestParam(name = "redirect", required = false) String redirect,
      HttpServletRequest request) {
    final ProviderAdapter adapter = providerAdapterRegistry.require(provider);
    final LoginRedirect loginRedirect =
        adapter.buildLoginRedirect(AuthGateway.originOf(request), redirect);
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(loginRedirect.location())
        .header(HttpHeaders.SET_COOKIE, loginRedirect.stateCookie().toString())
        .build();
  }

  /**
   * 役割:
   * - IdP からの callback を処理してログインを完了する。
   *
   * 期待動作:
   * - 成功時はセッション Cookie を発行し、state Cookie を消して元の画面へ 302。
   * - 検証失敗は 400、上流失敗は 500、許可リスト外は 403 を例外ハンドラが返す。
   */
  @GetMapping("/auth/{provider}/callback")
  public ResponseEntity<Void> callback(
      @PathVariable("provider") String provider,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "error", required = false) String error,
      HttpServletRequest request) {
    final ProviderAdapter adapter = providerAdapterRegistry.require(provider);
    final CallbackResult result =
        adapter.handleCallback(
            new CallbackRequest(
                AuthGateway.originOf(request),
                code,
                state,
                error,
                sessionTokenService.readStateCookie(request).orElse(null)));
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(RedirectTargets.toLocation(result.redirectTarget()))
        .header(HttpHeaders.SET_COOKIE, result.sessionCookie().toString())
        .header(HttpHeaders.SET_COOKIE, result.clearedStateCookie().toString())
        .build();
  }

  /**
   * 役割:
   * - アプリ内 SDK が取得したアクセストークンでログインを完了する。
   *
   * 期待動作:
   * - セッション Cookie を発行し、外部ブラウザで開くための bridge_url を返す。
   */
  @PostMapping("/auth/woff/callback")
  public ResponseEntity<MiniAppSessionResponse> miniAppCallback(
      @RequestBody MiniAppTokenRequest body) {
    final MiniAppLoginResult result =
        miniAppTokenExchangeService.exchange(body.accessToken(), body.redirect());
    return ResponseEntity.ok()
        .header(HttpHeaders.SET_COOKIE, result.sessionCookie().toString())
        .body(new MiniAppSessionResponse(result.redirectTarget(), result.bridgeUrl()));
  }

  /**
   * 役割:
   * - 一時トークンを引き換えて、このブラウザにセッションを発行する。
   *
   * 期待動作:
   * - 無効・期限切れのトークンは 401 で、Cookie は発行しない。
   */
  @GetMapping("/auth/token")
  public ResponseEntity<?> redeemBridgingToken(
      @RequestParam(name = "token", required = false) String token,
      @RequestParam(name = "redirect", required = false) String redirect) {
    final Optional<LoginCompletion> completion = miniAppTokenExchangeService.redeem(token);
    if (completion.isEmpty()) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(new ApiErrorResponse("INVALID_TOKEN", "Invalid or expired token"));
    }
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(RedirectTargets.toLocation(redirect))
        .header(HttpHeaders.SET_COOKIE, completion.get().sessionCookie().toString())
        .build();
  }

  // セッションはサーバー側に無いので Cookie を消すだけ
  @GetMapping("/logout")
  public ResponseEntity<Void> logout() {
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create("/login"))
        .header(HttpHeaders.SET_COOKIE, sessionTokenService.clear().toString())
        .build();
  }

  @GetMapping("/api/auth/check")
  public ResponseEntity<AuthCheckResponse> check(@AuthenticationPrincipal Identity identity) {
    return ResponseEntity.ok(new AuthCheckResponse(identity != null));
  }

  private String withRedirect(String path, String target) {
    return UriComponentsBuilder.fromPath(path)
        .queryParam("redirect", target)
        .build()
        .encode()
        .toUriString();
  }
}
