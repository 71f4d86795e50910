/*
 * どこで: Reminder Scheduler アプリの起動テスト
 * 何を: NATS 無効時に Spring コンテキストが起動し、インメモリキューが選ばれることを確認する
 * なぜ: 基本の構成が壊れていないことを保証するため
 */
package com.carecircle.reminder;

import static org.assertj.core.api.Assertions.assertThat;

import com.carecircle.reminder.queue.InMemoryReminderJobQueue;
import com.carecircle.reminder.queue.ReminderJobQueue;
import com.carecircle.reminder.service.ReminderScanner;
import com.carecircle.reminder.service.ReminderScheduler;
import com.carecircle.reminder.service.SchedulerState;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReminderSchedulerApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private ReminderJobQueue jobQueue;
  @Autowired private List<ReminderScanner> scanners;
  @Autowired private ReminderScheduler scheduler;

  @Test
  void contextLoadsWithInMemoryQueueAndAllScanners() {
    assertThat(jobQueue).isInstanceOf(InMemoryReminderJobQueue.class);
    assertThat(scanners).hasSize(4);
    // test プロファイルではループを起動しない
    assertThat(scheduler.state()).isEqualTo(SchedulerState.STOPPED);
  }
}
