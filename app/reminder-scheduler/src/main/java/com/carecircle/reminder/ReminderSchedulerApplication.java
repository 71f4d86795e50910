/*
 * どこで: Reminder Scheduler アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: 設定クラスと共通 Clock をまとめて有効化するため
 */
package com.carecircle.reminder;

import com.carecircle.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ReminderSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReminderSchedulerApplication.class, args);
  }
}
