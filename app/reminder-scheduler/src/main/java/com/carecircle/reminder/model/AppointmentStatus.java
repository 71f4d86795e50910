/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: 通院予定の状態を表す列挙
 * なぜ: DB の AppointmentStatus 型と値を一致させるため
 */
package com.carecircle.reminder.model;

public enum AppointmentStatus {
  SCHEDULED,
  CONFIRMED,
  COMPLETED,
  CANCELLED,
  NO_SHOW
}
