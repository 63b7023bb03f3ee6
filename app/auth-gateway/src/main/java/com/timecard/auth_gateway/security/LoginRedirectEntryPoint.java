package com.timecard.auth_gateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timecard.auth_gateway.api.ApiErrorResponse;
import com.timecard.auth_gateway.service.AuthGateway;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

// API 呼び出しには 401 JSON、画面遷移にはログイン画面への 302 を返す
@RequiredArgsConstructor
public class LoginRedirectEntryPoint implements AuthenticationEntryPoint {

  static final String UNAUTHENTICATED_CODE = "UNAUTHENTICATED";

  private final AuthGateway authGateway;
  private final ObjectMapper objectMapper;

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    if (request.getRequestURI().startsWith("/api/")) {
      response.setStatus(HttpStatus.UNAUTHORIZED.value());
      response.setCharacterEncoding(StandardCharsets.UTF_8.name());
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getWriter(), new ApiErrorResponse(UNAUTHENTICATED_CODE, "Unauthorized"));
      return;
    }
    response.sendRedirect(authGateway.buildLoginRedirect(request).toString());
  }
}
