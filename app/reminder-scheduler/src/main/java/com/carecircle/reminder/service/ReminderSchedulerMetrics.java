/*
 * どこで: Reminder Scheduler サービス層
 * 何を: sweep 時間/リマインダー結果/スキャナ失敗/走査見送り/tick 遅延のメトリクスを記録する
 * なぜ: 状態を持たない scheduler の稼働記録を Prometheus から観測できるようにするため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.model.ReminderDomain;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ReminderSchedulerMetrics {

  private static final String METRIC_SCAN_DURATION = "reminder.scan.duration";
  private static final String METRIC_REMINDER_TOTAL = "reminder.reminders.total";
  private static final String METRIC_SCANNER_FAILURE_TOTAL = "reminder.scanner.failure.total";
  private static final String METRIC_SCAN_SKIPPED_TOTAL = "reminder.scan.skipped.total";
  private static final String METRIC_MISSED_TICK_TOTAL = "reminder.sweep.missed_tick.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Timer> scanTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> reminderCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> scannerFailureCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> scanSkippedCounters = new ConcurrentHashMap<>();
  private final Counter missedTickCounter;

  public ReminderSchedulerMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.missedTickCounter =
        Counter.builder(METRIC_MISSED_TICK_TOTAL)
            .description("Sweeps that started later than interval plus tolerance")
            .register(meterRegistry);
  }

  public void recordScanReport(ScanReport report, Duration elapsed) {
    final String domain = report.domain().tag();
    recordScanDuration(domain, "completed", elapsed);
    increment(domain, "enqueued", report.enqueued());
    increment(domain, "duplicate", report.duplicates());
    increment(domain, "suppressed", report.suppressed());
    increment(domain, "skipped", report.skipped());
    increment(domain, "failed", report.failures().size());
  }

  public void recordScannerFailure(ReminderDomain domain, Duration elapsed) {
    recordScanDuration(domain.tag(), "failed", elapsed);
    scannerFailureCounters
        .computeIfAbsent(
            domain.tag(),
            tag ->
                Counter.builder(METRIC_SCANNER_FAILURE_TOTAL)
                    .description("Scanner runs aborted by an unexpected error")
                    .tags(Tags.of("domain", tag))
                    .register(meterRegistry))
        .increment();
  }

  /** その tick で走らせなかった走査を数える。reason は overrun / rejected / stale。 */
  public void recordScanSkipped(ReminderDomain domain, String reason) {
    scanSkippedCounters
        .computeIfAbsent(
            domain.tag() + ":" + reason,
            ignored ->
                Counter.builder(METRIC_SCAN_SKIPPED_TOTAL)
                    .description("Scanner runs not executed for a tick")
                    .tags(Tags.of("domain", domain.tag(), "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordMissedTick() {
    missedTickCounter.increment();
  }

  private void recordScanDuration(String domain, String outcome, Duration elapsed) {
    scanTimers
        .computeIfAbsent(
            domain + ":" + outcome,
            ignored ->
                Timer.builder(METRIC_SCAN_DURATION)
                    .description("Duration of one scanner run within a sweep")
                    .tags(Tags.of("domain", domain, "outcome", outcome))
                    .register(meterRegistry))
        .record(elapsed);
  }

  private void increment(String domain, String result, int amount) {
    if (amount <= 0) {
      return;
    }
    reminderCounters
        .computeIfAbsent(
            domain + ":" + result,
            ignored ->
                Counter.builder(METRIC_REMINDER_TOTAL)
                    .description("Reminder outcomes per domain")
                    .tags(Tags.of("domain", domain, "result", result))
                    .register(meterRegistry))
        .increment(amount);
  }
}
