/*
 * どこで: Reminder ジョブキュー
 * 何を: enqueue の結果(新規登録/重複として破棄)を表す
 * なぜ: 重複排除が効いたかをメトリクスとテストで観測するため
 */
package com.carecircle.reminder.queue;

public enum EnqueueResult {
  ENQUEUED,
  DUPLICATE
}
