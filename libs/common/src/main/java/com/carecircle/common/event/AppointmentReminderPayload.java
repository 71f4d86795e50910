/*
 * どこで: common のジョブ payload 定義
 * 何を: appointment-reminders キューに載せる通院リマインダーの形状
 * なぜ: scheduler と通知ワーカーで同一のペイロード形状を共有するため
 */
package com.carecircle.common.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppointmentReminderPayload(
    String appointmentId,
    String careRecipientId,
    String appointmentTime,
    String title,
    String location,
    int minutesBefore) {}
