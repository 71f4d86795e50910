/*
 * どこで: Reminder Scheduler サービス層
 * 何を: 1 回の sweep で全スキャナが出した結果のまとめ
 * なぜ: 並行実行したスキャナの結果を settle-all で 1 つに集約するため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.Instant;
import java.util.List;

public record SweepSummary(
    String sweepId,
    Instant startedAt,
    List<ScanReport> reports,
    List<ReminderDomain> failedDomains,
    List<ReminderDomain> skippedDomains) {

  public SweepSummary {
    reports = List.copyOf(reports);
    failedDomains = List.copyOf(failedDomains);
    skippedDomains = List.copyOf(skippedDomains);
  }

  public int totalEnqueued() {
    return reports.stream().mapToInt(ScanReport::enqueued).sum();
  }
}
