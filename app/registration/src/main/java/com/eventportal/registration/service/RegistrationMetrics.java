/*
 * どこで: Registration サービス層
 * 何を: 登録/取消の結果と昇格・競合再試行の回数を記録する
 * なぜ: 混雑時の成功率と競合の発生状況を運用で監視できるようにするため
 */
package com.eventportal.registration.service;

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
public class RegistrationMetrics {

  static final String METRIC_COMMAND_TOTAL = "registration.command.total";
  static final String METRIC_PROMOTION_TOTAL = "registration.promotion.total";
  static final String METRIC_CONFLICT_RETRY_TOTAL = "registration.conflict.retry.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final Counter promotionCounter;
  private final Counter conflictRetryCounter;

  public RegistrationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.promotionCounter =
        Counter.builder(METRIC_PROMOTION_TOTAL)
            .description("Waitlisted registrations promoted to confirmed")
            .register(meterRegistry);
    this.conflictRetryCounter =
        Counter.builder(METRIC_CONFLICT_RETRY_TOTAL)
            .description("Registration units of work retried after a transient conflict")
            .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("Registration command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPromotion() {
    promotionCounter.increment();
  }

  public void recordConflictRetry() {
    conflictRetryCounter.increment();
  }
}
