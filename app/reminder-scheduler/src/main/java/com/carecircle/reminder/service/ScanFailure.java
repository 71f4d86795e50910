/*
 * どこで: Reminder Scheduler サービス層
 * 何を: 走査中に 1 件のエンティティ(またはその 1 オフセット)で起きた失敗
 * なぜ: 1 件の失敗で走査全体を止めず、ループ後にまとめてログへ出すため
 */
package com.carecircle.reminder.service;

public record ScanFailure(String entityId, Integer minutesBefore, Exception cause) {}
