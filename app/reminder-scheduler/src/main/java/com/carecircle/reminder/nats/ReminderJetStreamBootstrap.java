/*
 * どこで: Reminder Scheduler NATS 初期化
 * 何を: 4 つのリマインダーキューの subject を持つ JetStream stream を起動時に作成/更新する
 * なぜ: publish 前に stream を確保し Nats-Msg-Id の重複排除を有効化するため
 */
package com.carecircle.reminder.nats;

import com.carecircle.reminder.config.ReminderNatsProperties;
import com.carecircle.reminder.model.ReminderDomain;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ReminderJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(ReminderJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
  // 冪等キーは日付単位のものがあるため、1 日分の重複を吸収できない window は危険
  private static final Duration RECOMMENDED_DUPLICATE_WINDOW = Duration.ofHours(24);

  private final Connection connection;
  private final ReminderNatsProperties properties;

  @PostConstruct
  public void start() {
    ensureSettings();
    try {
      final StreamConfiguration streamConfiguration =
          StreamConfiguration.builder()
              .name(properties.stream())
              .subjects(subjects())
              .duplicateWindow(properties.duplicateWindow())
              .build();
      final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
      upsertStream(jetStreamManagement, streamConfiguration);
      logger.info(
          "reminder stream ensured stream={} subjects={} duplicateWindow={}",
          properties.stream(),
          subjects(),
          properties.duplicateWindow());
    } catch (IOException | JetStreamApiException ex) {
      throw new IllegalStateException("failed to ensure JetStream stream", ex);
    }
  }

  List<String> subjects() {
    return Arrays.stream(ReminderDomain.values()).map(properties::subject).toList();
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private void ensureSettings() {
    if (properties.stream() == null || properties.stream().isBlank()) {
      throw new IllegalStateException("reminder.nats.stream must be set");
    }
    if (properties.duplicateWindow() == null) {
      throw new IllegalStateException("reminder.nats.duplicate-window must be set");
    }
    if (properties.duplicateWindow().isZero() || properties.duplicateWindow().isNegative()) {
      throw new IllegalStateException("reminder.nats.duplicate-window must be positive");
    }
    if (properties.duplicateWindow().compareTo(RECOMMENDED_DUPLICATE_WINDOW) < 0) {
      logger.warn(
          "duplicate window shorter than a day; day-scoped reminder keys may be re-enqueued duplicateWindow={}",
          properties.duplicateWindow());
    }
  }
}
