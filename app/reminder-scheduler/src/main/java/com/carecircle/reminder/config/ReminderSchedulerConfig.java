/*
 * どこで: Reminder Scheduler の Bean 定義
 * 何を: 登録済みの全スキャナを束ねた ReminderScheduler を組み立てる
 * なぜ: ループの状態をグローバルに持たず、インスタンスに閉じ込めるため
 */
package com.carecircle.reminder.config;

import com.carecircle.reminder.service.ReminderScanner;
import com.carecircle.reminder.service.ReminderScheduler;
import com.carecircle.reminder.service.ReminderSchedulerMetrics;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReminderSchedulerConfig {

  @Bean
  public ReminderScheduler reminderScheduler(
      List<ReminderScanner> scanners,
      ReminderSchedulerProperties properties,
      ReminderSchedulerMetrics metrics,
      Clock clock) {
    return new ReminderScheduler(scanners, properties, metrics, clock);
  }
}
