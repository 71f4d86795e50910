/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: Medication テーブルのうち scheduler が読む列のスナップショット
 * なぜ: 服薬リマインダーと残薬アラートの両方で共通化するため
 */
package com.carecircle.reminder.model;

import java.util.List;

public record Medication(
    String id,
    String careRecipientId,
    String name,
    String dosage,
    List<String> scheduledTimes,
    Integer currentSupply,
    Integer refillAt) {

  public Medication {
    scheduledTimes = scheduledTimes == null ? List.of() : List.copyOf(scheduledTimes);
  }
}
