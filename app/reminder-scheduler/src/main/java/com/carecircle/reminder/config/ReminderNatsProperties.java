/*
 * どこで: Reminder Scheduler の設定バインド
 * 何を: リマインダーキューの subject 接頭辞と JetStream stream 設定を保持する
 * なぜ: Nats-Msg-Id による重複排除の前提となる stream を環境で揃えるため
 */
package com.carecircle.reminder.config;

import com.carecircle.reminder.model.ReminderDomain;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "reminder.nats")
public record ReminderNatsProperties(
    @NotBlank String subjectPrefix, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  public String subject(ReminderDomain domain) {
    return subjectPrefix + "." + domain.queueName();
  }
}
