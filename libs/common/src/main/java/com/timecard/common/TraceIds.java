package com.timecard.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // ヘッダ由来の ID は空白と長すぎる値を捨て、ログ汚染を防ぐ
  public static String sanitize(String candidate) {
    if (candidate == null) {
      return null;
    }
    final String trimmed = candidate.trim();
    if (trimmed.isEmpty() || trimmed.length() > 128) {
      return null;
    }
    return trimmed;
  }
}
