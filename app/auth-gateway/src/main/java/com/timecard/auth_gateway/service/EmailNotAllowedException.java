package com.timecard.auth_gateway.service;

// 本人確認は成功したが許可リストに無いメールアドレス。セッションは発行しない。
public class EmailNotAllowedException extends RuntimeException {

  public static final String USER_MESSAGE = "このメールアドレスは許可されていません";

  private final String email;

  public EmailNotAllowedException(String email) {
    super(USER_MESSAGE);
    this.email = email;
  }

  /** ログ用。ローカル部は出さない。 */
  public String emailDomain() {
    if (email == null) {
      return "";
    }
    final int at = email.lastIndexOf('@');
    return at < 0 ? "" : email.substring(at + 1);
  }
}
