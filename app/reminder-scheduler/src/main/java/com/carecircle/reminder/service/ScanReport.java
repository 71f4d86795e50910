/*
 * どこで: Reminder Scheduler サービス層
 * 何を: 1 回の走査で得た結果(投入/重複/抑止/スキップ/失敗)を集計する
 * なぜ: エンティティ単位の失敗を例外で巻き戻さず、結果として持ち回るため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.model.ReminderDomain;
import java.util.ArrayList;
import java.util.List;

/** 1 スキャナの 1 回の走査に閉じて使う。スレッド間で共有しない。 */
public final class ScanReport {

  private final ReminderDomain domain;
  private final List<ScanFailure> failures = new ArrayList<>();
  private int enqueued;
  private int duplicates;
  private int suppressed;
  private int skipped;

  public ScanReport(ReminderDomain domain) {
    this.domain = domain;
  }

  void recordEnqueued() {
    enqueued++;
  }

  void recordDuplicate() {
    duplicates++;
  }

  void recordSuppressed() {
    suppressed++;
  }

  void recordSkipped() {
    skipped++;
  }

  void recordFailure(ScanFailure failure) {
    failures.add(failure);
  }

  public ReminderDomain domain() {
    return domain;
  }

  public int enqueued() {
    return enqueued;
  }

  public int duplicates() {
    return duplicates;
  }

  public int suppressed() {
    return suppressed;
  }

  public int skipped() {
    return skipped;
  }

  public List<ScanFailure> failures() {
    return List.copyOf(failures);
  }

  public boolean hasActivity() {
    return enqueued + duplicates + suppressed + skipped + failures.size() > 0;
  }
}
