/*
 * どこで: Reminder Scheduler ドメインモデル
 * 何を: 被介護者の家族メンバー(通知先候補)を表す
 * なぜ: 残薬アラートの宛先を決めるため
 */
package com.carecircle.reminder.model;

public record FamilyMember(String userId, FamilyRole role) {}
