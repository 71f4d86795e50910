/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: リマインダーはサーバーローカルの時刻帯で評価するため、既定ゾーンの Clock を共有する
 */
package com.carecircle.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    // "08:00" のような服薬時刻はサーバーのローカル時刻として解釈する
    return Clock.systemDefaultZone();
  }
}
