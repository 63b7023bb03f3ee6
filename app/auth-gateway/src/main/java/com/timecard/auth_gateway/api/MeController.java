package com.timecard.auth_gateway.api;

import com.timecard.auth_gateway.api.response.MeResponse;
import com.timecard.auth_gateway.model.Identity;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MeController {

  /**
   * 役割:
   * - 後段アプリが参照する、認証済みユーザーの Identity を返す。
   *
   * 期待動作:
   * - 未認証の呼び出しはセキュリティ設定により 401 JSON で止まり、ここには来ない。
   */
  @GetMapping("/api/me")
  public ResponseEntity<MeResponse> me(@AuthenticationPrincipal Identity identity) {
    if (identity == null) {
      return ResponseEntity.status(401).build();
    }
    return ResponseEntity.ok(MeResponse.from(identity));
  }
}
