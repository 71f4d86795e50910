/*
 * どこで: Reminder ジョブキュー
 * 何を: enqueue 時に渡すジョブ ID とリトライ/完了時削除の方針
 * なぜ: 重複排除キーとワーカー側の再試行方針をジョブ単位で運ぶため
 */
package com.carecircle.reminder.queue;

import java.time.Duration;
import java.util.Objects;

public record JobOptions(
    String jobId, int attempts, Duration backoffDelay, boolean removeOnComplete) {

  public JobOptions {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(backoffDelay, "backoffDelay");
    if (jobId.isBlank()) {
      throw new IllegalArgumentException("jobId must not be blank");
    }
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be positive");
    }
  }
}
