package com.timecard.auth_gateway.model;

import java.net.URI;
import org.springframework.http.ResponseCookie;

// 認可エンドポイントへの 302 先と、同時に発行する state Cookie
public record LoginRedirect(URI location, ResponseCookie stateCookie) {}
