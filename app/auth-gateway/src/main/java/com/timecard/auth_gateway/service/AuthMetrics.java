/*
 * どこで: Auth Gateway サービス層
 * 何を: ログイン結果・認証元・エラーコードごとの件数を記録する
 * なぜ: プロバイダ別のログイン成功率と認証失敗の増加を Prometheus から観測するため
 */
package com.timecard.auth_gateway.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_AUTHENTICATION_TOTAL = "auth.authentication.total";
  private static final String METRIC_ERROR_TOTAL = "auth.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> authenticationCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> errorCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLogin(String provider, String result) {
    final String key = provider + "|" + result;
    loginCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("Login completions by provider and outcome")
                    .tags(Tags.of("provider", provider, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  // source は cf_access / session / none のいずれか
  public void recordAuthentication(String source) {
    authenticationCounters
        .computeIfAbsent(
            source,
            ignored ->
                Counter.builder(METRIC_AUTHENTICATION_TOTAL)
                    .description("Request authentication decisions by source")
                    .tags(Tags.of("source", source))
                    .register(meterRegistry))
        .increment();
  }

  public void recordError(String code) {
    errorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_ERROR_TOTAL)
                    .description("Auth endpoint errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}
