package com.timecard.auth_gateway.service;

import com.timecard.auth_gateway.config.EmailAllowlistProperties;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

// "@" で始まるエントリはドメイン後方一致、それ以外は完全一致。大文字小文字は区別しない。
@Component
public class EmailAllowlistFilter {

  private final List<String> entries;

  public EmailAllowlistFilter(EmailAllowlistProperties properties) {
    this.entries = parseEntries(properties.allowedEmails());
  }

  static EmailAllowlistFilter of(String allowedEmails) {
    return new EmailAllowlistFilter(new EmailAllowlistProperties(allowedEmails));
  }

  /** 許可リスト未設定のときはチェック自体を行わない。 */
  public boolean isEnabled() {
    return !entries.isEmpty();
  }

  public boolean isAllowed(String email) {
    if (!isEnabled()) {
      return true;
    }
    if (email == null || email.isBlank()) {
      return false;
    }
    final String normalized = email.trim().toLowerCase(Locale.ROOT);
    for (String entry : entries) {
      if (entry.startsWith("@") ? normalized.endsWith(entry) : normalized.equals(entry)) {
        return true;
      }
    }
    return false;
  }

  private static List<String> parseEntries(String allowedEmails) {
    if (allowedEmails == null) {
      return List.of();
    }
    return Arrays.stream(allowedEmails.split(","))
        .map(entry -> entry.trim().toLowerCase(Locale.ROOT))
        .filter(entry -> !entry.isEmpty())
        .toList();
  }
}
