/*
 * どこで: Reminder Scheduler サービス補助
 * 何を: (ドメイン, エンティティ ID, 発生識別子, オフセット) から冪等キーを生成する
 * なぜ: 同じ論理リマインダーに毎回同じジョブ ID を与え、キュー側の重複排除に二重投入を任せるため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

@Component
public class ReminderJobKeyBuilder {

  private static final DateTimeFormatter CLOCK_TIME = DateTimeFormatter.ofPattern("HH:mm");
  private static final String SEPARATOR = "-";

  /**
   * 役割: 冪等キーの唯一の組み立て口。
   * 動作: {prefix}-{entityId}[-{discriminator}][-{offset}] を返す。null の要素は省く。
   * 前提: キー形式はキューのバックエンドで既に使われている形式と互換であること。
   */
  public String build(
      ReminderDomain domain, String entityId, String discriminator, Integer offsetMinutes) {
    if (entityId == null || entityId.isBlank()) {
      throw new IllegalArgumentException("entityId is required");
    }
    if (offsetMinutes != null && offsetMinutes < 0) {
      throw new IllegalArgumentException("offsetMinutes must not be negative");
    }
    final StringJoiner joiner = new StringJoiner(SEPARATOR);
    joiner.add(domain.keyPrefix()).add(entityId);
    if (discriminator != null) {
      joiner.add(discriminator);
    }
    if (offsetMinutes != null) {
      joiner.add(Integer.toString(offsetMinutes));
    }
    return joiner.toString();
  }

  // 1 日 1 回の服薬時刻ごとに 1 キー
  public String medicationKey(
      String medicationId, LocalDate date, LocalTime clockTime, int offsetMinutes) {
    final String discriminator = date + SEPARATOR + CLOCK_TIME.format(clockTime);
    return build(ReminderDomain.MEDICATION, medicationId, discriminator, offsetMinutes);
  }

  // 単発イベントなので ID とオフセットだけで一意になる
  public String appointmentKey(String appointmentId, int offsetMinutes) {
    return build(ReminderDomain.APPOINTMENT, appointmentId, null, offsetMinutes);
  }

  public String shiftKey(String shiftId, int offsetMinutes) {
    return build(ReminderDomain.SHIFT, shiftId, null, offsetMinutes);
  }

  // 1 薬につき 1 日 1 通まで
  public String refillKey(String medicationId, LocalDate date) {
    return build(ReminderDomain.REFILL, medicationId, date.toString(), null);
  }
}
