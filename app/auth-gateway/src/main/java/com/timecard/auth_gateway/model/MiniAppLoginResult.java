package com.timecard.auth_gateway.model;

import org.springframework.http.ResponseCookie;

public record MiniAppLoginResult(
    Identity identity, ResponseCookie sessionCookie, String redirectTarget, String bridgeUrl) {}
