/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: CaregiverShift テーブルのうち scheduler が読む列のスナップショット
 * なぜ: シフト開始リマインダーの payload を組み立てるため
 */
package com.carecircle.reminder.model;

import java.time.Instant;

public record CaregiverShift(
    String id,
    String careRecipientId,
    String caregiverId,
    Instant startTime,
    ShiftStatus status) {}
