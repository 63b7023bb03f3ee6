package com.timecard.auth_gateway.model;

import org.springframework.http.ResponseCookie;

public record LoginCompletion(Identity identity, ResponseCookie sessionCookie) {}
