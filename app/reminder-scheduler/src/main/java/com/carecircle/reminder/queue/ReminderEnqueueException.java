/*
 * どこで: Reminder ジョブキュー
 * 何を: キューへの投入失敗を表す検査例外
 * なぜ: 呼び出し側に (エンティティ, オフセット) 単位での失敗処理を強制するため
 */
package com.carecircle.reminder.queue;

public class ReminderEnqueueException extends Exception {

  private static final long serialVersionUID = 1L;

  public ReminderEnqueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
