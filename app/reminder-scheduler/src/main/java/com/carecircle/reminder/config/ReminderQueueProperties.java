/*
 * どこで: Reminder Scheduler の設定バインド
 * 何を: キューごとのジョブオプション(試行回数/バックオフ/完了時削除)を保持する
 * なぜ: リトライはワーカー側の責務だが、その方針はジョブと一緒に渡す必要があるため
 */
package com.carecircle.reminder.config;

import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.queue.JobOptions;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.queue")
public record ReminderQueueProperties(
    @Positive int defaultAttempts,
    @NotNull Duration defaultBackoff,
    boolean defaultRemoveOnComplete,
    @Positive int refillAttempts,
    boolean refillRemoveOnComplete) {

  public JobOptions jobOptions(ReminderDomain domain, String jobId) {
    return switch (domain) {
      case MEDICATION, APPOINTMENT, SHIFT ->
          new JobOptions(jobId, defaultAttempts, defaultBackoff, defaultRemoveOnComplete);
      // 数時間後に再送された残薬アラートには価値がないため、リトライさせない
      case REFILL -> new JobOptions(jobId, refillAttempts, Duration.ZERO, refillRemoveOnComplete);
    };
  }
}
