package com.timecard.auth_gateway.api.response;

public record AuthCheckResponse(boolean authenticated) {}
