/*
 * どこで: Reminder Scheduler スキャナ
 * 何を: 先読み範囲内の予約について、オフセットが今の分に当たるリマインダーを投入する
 * なぜ: 予約の直前通知を (予約, オフセット) ごとに 1 通だけ送るため
 */
package com.carecircle.reminder.service;

import com.carecircle.common.event.AppointmentReminderPayload;
import com.carecircle.reminder.config.ReminderSchedulerProperties;
import com.carecircle.reminder.model.Appointment;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.repository.AppointmentRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AppointmentReminderScanner implements ReminderScanner {

  private final AppointmentRepository appointmentRepository;
  private final ReminderJobKeyBuilder keyBuilder;
  private final ReminderDispatcher dispatcher;
  private final ReminderSchedulerProperties properties;

  @Override
  public ReminderDomain domain() {
    return ReminderDomain.APPOINTMENT;
  }

  @Override
  public ScanReport scan(ZonedDateTime now) {
    final ScanReport report = new ScanReport(domain());
    final List<Integer> offsets = properties.appointmentOffsets();
    if (offsets.isEmpty()) {
      return report;
    }
    // 分の先頭から読むことで、オフセット 0 の予約が同じ分の途中で範囲外にならない
    final Instant from = DueWindow.startOf(now.toInstant());
    final Instant to =
        now.toInstant()
            .plus(Duration.ofMinutes(Collections.max(offsets)))
            .plus(properties.lookaheadBuffer());
    final List<Appointment> appointments =
        appointmentRepository.findStartingBetween(from, to, properties.appointmentStatuses());
    for (Appointment appointment : appointments) {
      try {
        for (Integer offset : offsets) {
          final Instant candidate = appointment.startTime().minus(Duration.ofMinutes(offset));
          if (DueWindow.isDue(now.toInstant(), candidate)) {
            enqueue(appointment, offset, report);
          }
        }
      } catch (RuntimeException ex) {
        report.recordFailure(new ScanFailure(appointment.id(), null, ex));
      }
    }
    return report;
  }

  private void enqueue(Appointment appointment, int offset, ScanReport report) {
    final AppointmentReminderPayload payload =
        new AppointmentReminderPayload(
            appointment.id(),
            appointment.careRecipientId(),
            appointment.startTime().toString(),
            appointment.title(),
            appointment.location(),
            offset);
    dispatcher.dispatch(
        domain(),
        keyBuilder.appointmentKey(appointment.id(), offset),
        payload,
        appointment.id(),
        offset,
        report);
  }
}
