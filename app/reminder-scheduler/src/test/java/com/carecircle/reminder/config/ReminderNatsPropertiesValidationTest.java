/*
 * どこで: reminder.nats 設定バインドのバリデーションテスト
 * 何を: subject-prefix/stream/duplicate-window の必須検証と subject 組み立てを確認する
 * なぜ: 起動時に設定不備を検知して publish 時の失敗を防ぐため
 */
package com.carecircle.reminder.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.Duration;
import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class ReminderNatsPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void contextFailsWhenSubjectPrefixIsMissing() {
    contextRunner
        .withPropertyValues(
            "reminder.nats.stream=carecircle-reminders", "reminder.nats.duplicate-window=24h")
        .run(assertValidationFailure("subjectPrefix"));
  }

  @Test
  void contextFailsWhenStreamIsBlank() {
    // 空白のみも NotBlank で弾く
    contextRunner
        .withPropertyValues(
            "reminder.nats.subject-prefix=carecircle.jobs",
            "reminder.nats.stream=   ",
            "reminder.nats.duplicate-window=24h")
        .run(assertValidationFailure("stream"));
  }

  @Test
  void contextFailsWhenDuplicateWindowIsMissing() {
    contextRunner
        .withPropertyValues(
            "reminder.nats.subject-prefix=carecircle.jobs",
            "reminder.nats.stream=carecircle-reminders")
        .run(assertValidationFailure("duplicateWindow"));
  }

  @Test
  void contextStartsAndBuildsQueueSubjects() {
    contextRunner
        .withPropertyValues(
            "reminder.nats.subject-prefix=carecircle.jobs",
            "reminder.nats.stream=carecircle-reminders",
            "reminder.nats.duplicate-window=24h")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final ReminderNatsProperties properties =
                  context.getBean(ReminderNatsProperties.class);
              assertThat(properties.duplicateWindow()).isEqualTo(Duration.ofHours(24));
              assertThat(properties.subject(ReminderDomain.REFILL))
                  .isEqualTo("carecircle.jobs.refill-alerts");
            });
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedField) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root = Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedField);
    };
  }

  @Configuration
  @EnableConfigurationProperties(ReminderNatsProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
