/*
 * どこで: Auth Gateway API レスポンス DTO
 * 何を: ログイン画面に並べるプロバイダの一覧
 * なぜ: 画面描画は別アプリが担うため、ここでは遷移先 URL だけを渡す
 */
package com.timecard.auth_gateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LoginOptionsResponse(
    String redirect, List<ProviderLoginOption> providers, String woffLoginUrl) {

  public LoginOptionsResponse {
    providers = providers == null ? List.of() : List.copyOf(providers);
  }
}
