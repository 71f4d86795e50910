/*
 * どこで: Reminder Scheduler の NATS publish
 * 何を: リマインダージョブを JetStream の各キュー subject へ publish する
 * なぜ: 冪等キーを Nats-Msg-Id に載せ、stream の duplicate window で二重投入を潰すため
 */
package com.carecircle.reminder.nats;

import com.carecircle.reminder.config.ReminderNatsProperties;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.queue.EnqueueResult;
import com.carecircle.reminder.queue.JobOptions;
import com.carecircle.reminder.queue.ReminderEnqueueException;
import com.carecircle.reminder.queue.ReminderJobQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class JetStreamReminderJobQueue implements ReminderJobQueue {

  static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  static final String HEADER_JOB_TYPE = "job_type";
  static final String HEADER_ATTEMPTS = "job_attempts";
  static final String HEADER_BACKOFF_TYPE = "job_backoff_type";
  static final String HEADER_BACKOFF_DELAY_MS = "job_backoff_delay_ms";
  static final String HEADER_REMOVE_ON_COMPLETE = "job_remove_on_complete";
  private static final String BACKOFF_TYPE_EXPONENTIAL = "exponential";

  private final JetStream jetStream;
  private final ReminderNatsProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public EnqueueResult enqueue(ReminderDomain domain, Object payload, JobOptions options)
      throws ReminderEnqueueException {
    final byte[] body = serialize(domain, payload, options);
    final PublishAck ack;
    try {
      // puback を受け取れた場合のみ投入成功とみなす
      ack = jetStream.publish(properties.subject(domain), buildHeaders(domain, options), body);
    } catch (IOException | JetStreamApiException ex) {
      throw new ReminderEnqueueException(
          "failed to publish reminder job jobId=" + options.jobId(), ex);
    }
    if (ack == null) {
      throw new ReminderEnqueueException(
          "puback is missing jobId=" + options.jobId(), new IllegalStateException("puback is missing"));
    }
    return ack.isDuplicate() ? EnqueueResult.DUPLICATE : EnqueueResult.ENQUEUED;
  }

  private byte[] serialize(ReminderDomain domain, Object payload, JobOptions options)
      throws ReminderEnqueueException {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException ex) {
      throw new ReminderEnqueueException(
          "failed to serialize reminder payload queue=" + domain.queueName() + " jobId=" + options.jobId(),
          ex);
    }
  }

  private Headers buildHeaders(ReminderDomain domain, JobOptions options) {
    final Headers headers = new Headers();
    // 重複排除キーとして冪等キーを NATS の標準ヘッダに載せる
    headers.add(HEADER_MESSAGE_ID, options.jobId());
    headers.add(HEADER_JOB_TYPE, domain.jobType());
    // リトライ方針は consumer 側が解釈する
    headers.add(HEADER_ATTEMPTS, Integer.toString(options.attempts()));
    headers.add(HEADER_BACKOFF_TYPE, BACKOFF_TYPE_EXPONENTIAL);
    headers.add(HEADER_BACKOFF_DELAY_MS, Long.toString(options.backoffDelay().toMillis()));
    headers.add(HEADER_REMOVE_ON_COMPLETE, Boolean.toString(options.removeOnComplete()));
    return headers;
  }
}
