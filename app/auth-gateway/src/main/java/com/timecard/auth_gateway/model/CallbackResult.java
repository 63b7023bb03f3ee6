package com.timecard.auth_gateway.model;

import org.springframework.http.ResponseCookie;

public record CallbackResult(
    Identity identity,
    ResponseCookie sessionCookie,
    ResponseCookie clearedStateCookie,
    String redirectTarget) {}
