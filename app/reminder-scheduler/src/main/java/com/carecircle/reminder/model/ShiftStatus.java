/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: 介護シフトの状態を表す列挙
 * なぜ: DB の ShiftStatus 型と値を一致させるため
 */
package com.carecircle.reminder.model;

public enum ShiftStatus {
  SCHEDULED,
  CONFIRMED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED,
  NO_SHOW
}
