/*
 * どこで: ReminderSchedulerMetrics の単体テスト
 * 何を: 走査結果がドメイン/結果タグ付きのカウンタと timer に記録されることを検証する
 * なぜ: sweep の稼働記録をメトリクスだけで追えることを保証するため
 */
package com.carecircle.reminder.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.carecircle.reminder.model.ReminderDomain;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReminderSchedulerMetricsTest {

  @Test
  void recordsScanOutcomesPerDomain() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderSchedulerMetrics metrics = new ReminderSchedulerMetrics(registry);
    final ScanReport report = new ScanReport(ReminderDomain.MEDICATION);
    report.recordEnqueued();
    report.recordEnqueued();
    report.recordSuppressed();
    report.recordFailure(new ScanFailure("m1", 10, new IllegalStateException("boom")));

    metrics.recordScanReport(report, Duration.ofMillis(120));

    assertThat(counter(registry, "medication", "enqueued")).isEqualTo(2.0d);
    assertThat(counter(registry, "medication", "suppressed")).isEqualTo(1.0d);
    assertThat(counter(registry, "medication", "failed")).isEqualTo(1.0d);
    assertThat(registry.find("reminder.reminders.total").tag("result", "duplicate").counter())
        .isNull();
    assertThat(
            registry
                .get("reminder.scan.duration")
                .tag("domain", "medication")
                .tag("outcome", "completed")
                .timer()
                .count())
        .isEqualTo(1L);
  }

  @Test
  void recordsScannerFailureAndMissedTick() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderSchedulerMetrics metrics = new ReminderSchedulerMetrics(registry);

    metrics.recordScannerFailure(ReminderDomain.REFILL, Duration.ofMillis(5));
    metrics.recordMissedTick();

    assertThat(
            registry.get("reminder.scanner.failure.total").tag("domain", "refill").counter().count())
        .isEqualTo(1.0d);
    assertThat(
            registry
                .get("reminder.scan.duration")
                .tag("domain", "refill")
                .tag("outcome", "failed")
                .timer()
                .count())
        .isEqualTo(1L);
    assertThat(registry.get("reminder.sweep.missed_tick.total").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void recordsSkippedScansPerDomainAndReason() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final ReminderSchedulerMetrics metrics = new ReminderSchedulerMetrics(registry);

    metrics.recordScanSkipped(ReminderDomain.MEDICATION, "overrun");
    metrics.recordScanSkipped(ReminderDomain.MEDICATION, "overrun");
    metrics.recordScanSkipped(ReminderDomain.SHIFT, "stale");

    assertThat(
            registry
                .get("reminder.scan.skipped.total")
                .tag("domain", "medication")
                .tag("reason", "overrun")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(
            registry
                .get("reminder.scan.skipped.total")
                .tag("domain", "shift")
                .tag("reason", "stale")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  private static double counter(SimpleMeterRegistry registry, String domain, String result) {
    return registry
        .get("reminder.reminders.total")
        .tag("domain", domain)
        .tag("result", result)
        .counter()
        .count();
  }
}
