/*
 * どこで: Reminder ジョブキュー
 * 何を: 通知ワーカーへ渡すジョブの投入口
 * なぜ: scheduler が知るべきなのは「ID 付きで投入でき、同じ ID は 1 度しか受け付けない」ことだけだから
 */
package com.carecircle.reminder.queue;

import com.carecircle.reminder.model.ReminderDomain;

public interface ReminderJobQueue {

  /**
   * 役割: ドメインに対応するキューへジョブを投入する。
   * 動作: {@code options.jobId()} が既に受理済みなら {@link EnqueueResult#DUPLICATE} を返す。
   * 前提: payload は JSON 化可能な値であること。
   */
  EnqueueResult enqueue(ReminderDomain domain, Object payload, JobOptions options)
      throws ReminderEnqueueException;
}
