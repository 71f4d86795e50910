/*
 * どこで: common のジョブ payload 定義
 * 何を: shift-reminders キューに載せるシフト開始リマインダーの形状
 * なぜ: scheduler と通知ワーカーで同一のペイロード形状を共有するため
 */
package com.carecircle.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ShiftReminderPayload(
    String shiftId,
    String careRecipientId,
    String caregiverId,
    String startTime,
    int minutesBefore) {}
