/*
 * どこで: Auth Gateway モデル
 * 何を: どの認証元で確認されたかを含む正規化済みユーザー情報
 * なぜ: 後段は認証元を意識せずこの 1 形式だけを扱えばよいため
 */
package com.timecard.auth_gateway.model;

import java.time.Instant;
import java.util.Objects;

public record Identity(
    String sub,
    String email,
    String name,
    IdentityProvider provider,
    Instant issuedAt,
    Instant expiresAt) {

  public Identity {
    Objects.requireNonNull(provider, "provider is required");
    email = email == null ? "" : email;
    name = name == null ? "" : name;
  }

  // プロバイダ検証直後はまだトークン期限を持たない
  public static Identity unissued(
      String sub, String email, String name, IdentityProvider provider) {
    return new Identity(sub, email, name, provider, null, null);
  }
}
