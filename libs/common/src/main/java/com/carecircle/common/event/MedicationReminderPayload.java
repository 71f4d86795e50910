/*
 * どこで: common のジョブ payload 定義
 * 何を: medication-reminders キューに載せる服薬リマインダーの形状
 * なぜ: scheduler と通知ワーカーで同一のペイロード形状を共有するため
 */
package com.carecircle.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MedicationReminderPayload(
    String medicationId,
    String careRecipientId,
    String scheduledTime,
    String medicationName,
    String dosage,
    int minutesBefore) {}
