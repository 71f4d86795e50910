/*
 * どこで: Reminder Scheduler サービス層
 * 何を: 1 ドメイン分のリマインダーを走査して投入するスキャナの共通口
 * なぜ: sweep が各スキャナを同じ形で並行実行し、失敗をドメイン単位で隔離するため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.ZonedDateTime;

public interface ReminderScanner {

  ReminderDomain domain();

  /**
   * エンティティ単位の失敗は戻り値の {@link ScanReport} に積む。
   * 一覧取得の失敗など走査全体に及ぶものは例外として送出してよい。
   */
  ScanReport scan(ZonedDateTime now);
}
