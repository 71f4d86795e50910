/*
 * どこで: Reminder Scheduler サービス層
 * 何を: 冪等キー付きのジョブを投入し、結果を ScanReport へ記録する
 * なぜ: 4 つのスキャナで投入とキュー失敗の扱いを揃えるため
 */
package com.carecircle.reminder.service;

import com.carecircle.reminder.config.ReminderQueueProperties;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.queue.EnqueueResult;
import com.carecircle.reminder.queue.JobOptions;
import com.carecircle.reminder.queue.ReminderEnqueueException;
import com.carecircle.reminder.queue.ReminderJobQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReminderDispatcher {

  private final ReminderJobQueue jobQueue;
  private final ReminderQueueProperties queueProperties;

  /**
   * 役割: 1 件のリマインダーをキューへ投入する。
   * 動作: 投入失敗はこの tick では再試行せず、失敗として report に残して捨てる。
   * 前提: jobId は {@link ReminderJobKeyBuilder} で組み立てたもの。
   */
  public void dispatch(
      ReminderDomain domain,
      String jobId,
      Object payload,
      String entityId,
      Integer minutesBefore,
      ScanReport report) {
    final JobOptions options = queueProperties.jobOptions(domain, jobId);
    try {
      final EnqueueResult result = jobQueue.enqueue(domain, payload, options);
      switch (result) {
        case ENQUEUED -> report.recordEnqueued();
        case DUPLICATE -> report.recordDuplicate();
      }
    } catch (ReminderEnqueueException ex) {
      report.recordFailure(new ScanFailure(entityId, minutesBefore, ex));
    }
  }
}
