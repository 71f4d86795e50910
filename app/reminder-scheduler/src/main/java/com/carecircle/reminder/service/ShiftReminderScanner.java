/*
 * どこで: Reminder Scheduler スキャナ
 * 何を: 先読み範囲内の SCHEDULED シフトについて、開始前リマインダーを投入する
 * なぜ: 担当ケアギバーにシフト開始を (シフト, オフセット) ごとに 1 通だけ知らせるため
 */
package com.carecircle.reminder.service;

import com.carecircle.common.event.ShiftReminderPayload;
import com.carecircle.reminder.config.ReminderSchedulerProperties;
import com.carecircle.reminder.model.CaregiverShift;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.model.ShiftStatus;
import com.carecircle.reminder.repository.CaregiverShiftRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ShiftReminderScanner implements ReminderScanner {

  private final CaregiverShiftRepository shiftRepository;
  private final ReminderJobKeyBuilder keyBuilder;
  private final ReminderDispatcher dispatcher;
  private final ReminderSchedulerProperties properties;

  @Override
  public ReminderDomain domain() {
    return ReminderDomain.SHIFT;
  }

  @Override
  public ScanReport scan(ZonedDateTime now) {
    final ScanReport report = new ScanReport(domain());
    final List<Integer> offsets = properties.shiftOffsets();
    if (offsets.isEmpty()) {
      return report;
    }
    final Instant from = DueWindow.startOf(now.toInstant());
    final Instant to =
        now.toInstant()
            .plus(Duration.ofMinutes(Collections.max(offsets)))
            .plus(properties.lookaheadBuffer());
    for (CaregiverShift shift : shiftRepository.findStartingBetween(from, to, ShiftStatus.SCHEDULED)) {
      try {
        for (Integer offset : offsets) {
          final Instant candidate = shift.startTime().minus(Duration.ofMinutes(offset));
          if (DueWindow.isDue(now.toInstant(), candidate)) {
            enqueue(shift, offset, report);
          }
        }
      } catch (RuntimeException ex) {
        report.recordFailure(new ScanFailure(shift.id(), null, ex));
      }
    }
    return report;
  }

  private void enqueue(CaregiverShift shift, int offset, ScanReport report) {
    final ShiftReminderPayload payload =
        new ShiftReminderPayload(
            shift.id(),
            shift.careRecipientId(),
            shift.caregiverId(),
            shift.startTime().toString(),
            offset);
    dispatcher.dispatch(
        domain(), keyBuilder.shiftKey(shift.id(), offset), payload, shift.id(), offset, report);
  }
}
