/*
 * どこで: Reminder ジョブキュー
 * 何を: インメモリキューに保持したジョブのスナップショット
 * なぜ: ローカル実行とテストで投入内容を確認できるようにするため
 */
package com.carecircle.reminder.queue;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.Instant;

public record EnqueuedJob(
    ReminderDomain domain, String jobType, Object payload, JobOptions options, Instant enqueuedAt) {}
