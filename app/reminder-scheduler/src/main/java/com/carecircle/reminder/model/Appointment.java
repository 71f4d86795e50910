/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: Appointment テーブルのうち scheduler が読む列のスナップショット
 * なぜ: 通院リマインダーの payload を組み立てるため
 */
package com.carecircle.reminder.model;

import java.time.Instant;

public record Appointment(
    String id,
    String careRecipientId,
    String title,
    String location,
    Instant startTime,
    AppointmentStatus status) {}
