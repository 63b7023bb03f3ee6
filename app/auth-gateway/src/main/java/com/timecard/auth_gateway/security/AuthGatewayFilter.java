package com.timecard.auth_gateway.security;

import com.timecard.auth_gateway.model.AuthResult;
import com.timecard.auth_gateway.service.AuthGateway;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * {@link AuthGateway} の判定結果を SecurityContext に載せる。
 *
 * <p>公開パスでも判定は行う。{@code /api/auth/check} が認証状態を返すため。未認証時は何もせず、
 * 保護パスなら後段の entry point が応答を決める。
 */
public class AuthGatewayFilter extends OncePerRequestFilter {

  private final AuthGateway authGateway;

  public AuthGatewayFilter(AuthGateway authGateway) {
    this.authGateway = authGateway;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final AuthResult result = authGateway.authenticate(request);
    if (result.authenticated()) {
      final PreAuthenticatedAuthenticationToken authentication =
          new PreAuthenticatedAuthenticationToken(
              result.identity(), null, AuthorityUtils.createAuthorityList("ROLE_USER"));
      final SecurityContext context = SecurityContextHolder.createEmptyContext();
      context.setAuthentication(authentication);
      SecurityContextHolder.setContext(context);
    }
    filterChain.doFilter(request, response);
  }
}
