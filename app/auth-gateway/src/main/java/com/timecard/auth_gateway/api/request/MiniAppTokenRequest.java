/*
 * どこで: Auth Gateway API リクエスト DTO
 * 何を: LINE WORKS アプリ内 SDK から受け取るアクセストークンと遷移先
 * なぜ: 受信 JSON を型安全に取り扱うため
 */
package com.timecard.auth_gateway.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MiniAppTokenRequest(String accessToken, String redirect) {

  @Override
  public String toString() {
    return "MiniAppTokenRequest[accessToken=***, redirect=" + redirect + "]";
  }
}
