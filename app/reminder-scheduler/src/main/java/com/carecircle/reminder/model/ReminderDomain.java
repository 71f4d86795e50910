/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: リマインダーの種類とキュー名/ジョブ種別/キー接頭辞の対応を表す
 * なぜ: 種類を追加したときに switch の網羅性チェックで対応漏れを検知するため
 */
package com.carecircle.reminder.model;

import java.util.Locale;

public enum ReminderDomain {
  MEDICATION,
  APPOINTMENT,
  SHIFT,
  REFILL;

  public String queueName() {
    return switch (this) {
      case MEDICATION -> "medication-reminders";
      case APPOINTMENT -> "appointment-reminders";
      case SHIFT -> "shift-reminders";
      case REFILL -> "refill-alerts";
    };
  }

  public String jobType() {
    return switch (this) {
      case MEDICATION -> "medication-reminder";
      case APPOINTMENT -> "appointment-reminder";
      case SHIFT -> "shift-reminder";
      case REFILL -> "refill-alert";
    };
  }

  /** 冪等キーの先頭に付ける接頭辞。キューのバックエンドが認識する既存形式に合わせる。 */
  public String keyPrefix() {
    return switch (this) {
      case MEDICATION -> "med";
      case APPOINTMENT -> "apt";
      case SHIFT -> "shift";
      case REFILL -> "refill";
    };
  }

  /** メトリクス/ログ用の小文字タグ。 */
  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
