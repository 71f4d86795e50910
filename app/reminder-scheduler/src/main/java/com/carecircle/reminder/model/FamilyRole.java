/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: 家族メンバーの権限を表す列挙
 * なぜ: DB の FamilyRole 型と値を一致させるため
 */
package com.carecircle.reminder.model;

public enum FamilyRole {
  ADMIN,
  CAREGIVER,
  VIEWER
}
