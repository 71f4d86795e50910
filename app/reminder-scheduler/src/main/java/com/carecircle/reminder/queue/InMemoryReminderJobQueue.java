/*
 * どこで: Reminder ジョブキュー
 * 何を: NATS 無効時に使うインメモリ実装
 * なぜ: ローカル実行やテストで NATS なしでも同じ重複排除の挙動で起動できるようにするため
 */
package com.carecircle.reminder.queue;

import com.carecircle.reminder.model.ReminderDomain;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class InMemoryReminderJobQueue implements ReminderJobQueue {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryReminderJobQueue.class);

  private final Map<ReminderDomain, ConcurrentMap<String, EnqueuedJob>> queues =
      new EnumMap<>(ReminderDomain.class);
  private final Clock clock;

  public InMemoryReminderJobQueue(Clock clock) {
    this.clock = clock;
    for (ReminderDomain domain : ReminderDomain.values()) {
      queues.put(domain, new ConcurrentHashMap<>());
    }
  }

  @Override
  public EnqueueResult enqueue(ReminderDomain domain, Object payload, JobOptions options) {
    final EnqueuedJob job =
        new EnqueuedJob(domain, domain.jobType(), payload, options, Instant.now(clock));
    // 同一 jobId は最初の 1 件だけ受理する(キュー側の重複排除と同じ意味)
    final EnqueuedJob existing = queues.get(domain).putIfAbsent(options.jobId(), job);
    if (existing != null) {
      logger.debug("duplicate reminder job ignored queue={} jobId={}", domain.queueName(), options.jobId());
      return EnqueueResult.DUPLICATE;
    }
    logger.info("reminder job enqueued queue={} jobId={}", domain.queueName(), options.jobId());
    return EnqueueResult.ENQUEUED;
  }

  public List<EnqueuedJob> jobs(ReminderDomain domain) {
    return List.copyOf(queues.get(domain).values());
  }
}
