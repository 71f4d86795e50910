/*
 * どこで: Reminder Scheduler スキャナ
 * 何を: 有効な服薬予定ごとに、時刻とオフセットが今の分に当たるリマインダーを投入する
 * なぜ: 服用前の通知を 1 回の予定につき 1 通だけ送るため
 */
package com.carecircle.reminder.service;

import com.carecircle.common.event.MedicationReminderPayload;
import com.carecircle.reminder.config.ReminderSchedulerProperties;
import com.carecircle.reminder.model.Medication;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.repository.MedicationLogRepository;
import com.carecircle.reminder.repository.MedicationRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MedicationReminderScanner implements ReminderScanner {

  // "8:00" と "08:00" の両方を受け付ける
  private static final DateTimeFormatter SCHEDULED_TIME = DateTimeFormatter.ofPattern("H:mm");

  private final MedicationRepository medicationRepository;
  private final MedicationLogRepository medicationLogRepository;
  private final ReminderJobKeyBuilder keyBuilder;
  private final ReminderDispatcher dispatcher;
  private final ReminderSchedulerProperties properties;

  @Override
  public ReminderDomain domain() {
    return ReminderDomain.MEDICATION;
  }

  @Override
  public ScanReport scan(ZonedDateTime now) {
    final ScanReport report = new ScanReport(domain());
    for (Medication medication : medicationRepository.findActive()) {
      try {
        scanMedication(medication, now, report);
      } catch (RuntimeException ex) {
        report.recordFailure(new ScanFailure(medication.id(), null, ex));
      }
    }
    return report;
  }

  private void scanMedication(Medication medication, ZonedDateTime now, ScanReport report) {
    // 日付をまたぐオフセット(00:10 の 30 分前など)のため翌日分も評価する
    final LocalDate today = now.toLocalDate();
    final List<LocalDate> dates = List.of(today, today.plusDays(1));
    for (String rawTime : medication.scheduledTimes()) {
      final LocalTime clockTime;
      try {
        clockTime = LocalTime.parse(rawTime.trim(), SCHEDULED_TIME);
      } catch (DateTimeParseException ex) {
        report.recordFailure(new ScanFailure(medication.id(), null, ex));
        continue;
      }
      for (LocalDate date : dates) {
        final ZonedDateTime scheduled = ZonedDateTime.of(date, clockTime, now.getZone());
        for (Integer offset : properties.medicationOffsets()) {
          final Instant candidate = scheduled.toInstant().minus(Duration.ofMinutes(offset));
          if (!DueWindow.isDue(now.toInstant(), candidate)) {
            continue;
          }
          evaluate(medication, date, clockTime, scheduled, offset, report);
        }
      }
    }
  }

  private void evaluate(
      Medication medication,
      LocalDate date,
      LocalTime clockTime,
      ZonedDateTime scheduled,
      int offset,
      ScanReport report) {
    // 予定時刻の分に服薬記録があれば、それ以降のリマインダーは出さない
    final Instant scheduledInstant = scheduled.toInstant();
    if (medicationLogRepository.existsForScheduledWindow(
        medication.id(), DueWindow.startOf(scheduledInstant), DueWindow.endOf(scheduledInstant))) {
      report.recordSuppressed();
      return;
    }
    final String jobId = keyBuilder.medicationKey(medication.id(), date, clockTime, offset);
    final MedicationReminderPayload payload =
        new MedicationReminderPayload(
            medication.id(),
            medication.careRecipientId(),
            scheduledInstant.toString(),
            medication.name(),
            medication.dosage(),
            offset);
    dispatcher.dispatch(domain(), jobId, payload, medication.id(), offset, report);
  }
}
