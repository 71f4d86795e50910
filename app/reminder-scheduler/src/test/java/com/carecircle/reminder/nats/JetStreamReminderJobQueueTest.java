/*
 * どこで: JetStreamReminderJobQueue の単体テスト
 * 何を: subject/ヘッダ/本文の組み立てと puback による結果判定を検証する
 * なぜ: 冪等キーが Nats-Msg-Id に載らないと stream の重複排除が効かないため
 */
package com.carecircle.reminder.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.carecircle.common.event.ShiftReminderPayload;
import com.carecircle.reminder.config.ReminderNatsProperties;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.queue.EnqueueResult;
import com.carecircle.reminder.queue.JobOptions;
import com.carecircle.reminder.queue.ReminderEnqueueException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JetStreamReminderJobQueueTest {

  private static final ReminderNatsProperties PROPERTIES =
      new ReminderNatsProperties("carecircle.jobs", "carecircle-reminders", Duration.ofHours(24));
  private static final JobOptions OPTIONS =
      new JobOptions("shift-s1-15", 3, Duration.ofSeconds(1), false);
  private static final ShiftReminderPayload PAYLOAD =
      new ShiftReminderPayload("s1", "cr-1", "caregiver-1", "2026-03-10T07:00:00Z", 15);

  @Mock private JetStream jetStream;

  private JetStreamReminderJobQueue queue;

  @BeforeEach
  void setUp() {
    queue = new JetStreamReminderJobQueue(jetStream, PROPERTIES, new ObjectMapper());
  }

  @Test
  void publishesToQueueSubjectWithIdempotencyHeader() throws Exception {
    final PublishAck ack = mock(PublishAck.class);
    when(ack.isDuplicate()).thenReturn(false);
    when(jetStream.publish(anyString(), any(Headers.class), any(byte[].class))).thenReturn(ack);

    final EnqueueResult result = queue.enqueue(ReminderDomain.SHIFT, PAYLOAD, OPTIONS);

    assertThat(result).isEqualTo(EnqueueResult.ENQUEUED);
    final ArgumentCaptor<Headers> headers = ArgumentCaptor.forClass(Headers.class);
    final ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(jetStream)
        .publish(eq("carecircle.jobs.shift-reminders"), headers.capture(), body.capture());
    assertThat(headers.getValue().getFirst(JetStreamReminderJobQueue.HEADER_MESSAGE_ID))
        .isEqualTo("shift-s1-15");
    assertThat(headers.getValue().getFirst(JetStreamReminderJobQueue.HEADER_JOB_TYPE))
        .isEqualTo("shift-reminder");
    assertThat(headers.getValue().getFirst(JetStreamReminderJobQueue.HEADER_ATTEMPTS))
        .isEqualTo("3");
    assertThat(headers.getValue().getFirst(JetStreamReminderJobQueue.HEADER_BACKOFF_DELAY_MS))
        .isEqualTo("1000");
    assertThat(new String(body.getValue(), StandardCharsets.UTF_8))
        .contains("\"shift_id\":\"s1\"")
        .contains("\"minutes_before\":15");
  }

  @Test
  void duplicateAckMapsToDuplicate() throws Exception {
    final PublishAck ack = mock(PublishAck.class);
    when(ack.isDuplicate()).thenReturn(true);
    when(jetStream.publish(anyString(), any(Headers.class), any(byte[].class))).thenReturn(ack);

    assertThat(queue.enqueue(ReminderDomain.SHIFT, PAYLOAD, OPTIONS))
        .isEqualTo(EnqueueResult.DUPLICATE);
  }

  @Test
  void publishFailureIsWrapped() throws Exception {
    when(jetStream.publish(anyString(), any(Headers.class), any(byte[].class)))
        .thenThrow(new IOException("timeout"));

    assertThatThrownBy(() -> queue.enqueue(ReminderDomain.SHIFT, PAYLOAD, OPTIONS))
        .isInstanceOf(ReminderEnqueueException.class)
        .hasCauseInstanceOf(IOException.class)
        .hasMessageContaining("shift-s1-15");
  }

  @Test
  void missingAckIsFailure() throws Exception {
    when(jetStream.publish(anyString(), any(Headers.class), any(byte[].class))).thenReturn(null);

    assertThatThrownBy(() -> queue.enqueue(ReminderDomain.SHIFT, PAYLOAD, OPTIONS))
        .isInstanceOf(ReminderEnqueueException.class);
  }
}
