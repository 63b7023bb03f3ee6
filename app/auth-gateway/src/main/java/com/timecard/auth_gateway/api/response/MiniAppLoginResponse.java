package com.timecard.auth_gateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

// SDK ページ初期化用
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MiniAppLoginResponse(String woffId, String callbackPath) {}
