/*
 * どこで: Reminder Scheduler の起動/停止
 * 何を: アプリ起動完了で sweep ループを開始し、終了時に停止する
 * なぜ: DB/NATS の準備が整ってから最初の sweep を走らせるため
 */
package com.carecircle.reminder.service;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    name = "reminder.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class ReminderSchedulerWorker {

  private final ReminderScheduler scheduler;

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    scheduler.start();
  }

  @PreDestroy
  public void stop() {
    scheduler.stop();
  }
}
