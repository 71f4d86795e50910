/*
 * どこで: Reminder Scheduler スキャナ
 * 何を: 残薬が閾値以下の薬について、家族の管理者/ケアギバーへ補充アラートを投入する
 * なぜ: 補充の必要を 1 薬につき 1 日 1 通だけ知らせるため
 */
package com.carecircle.reminder.service;

import com.carecircle.common.event.RefillAlertPayload;
import com.carecircle.reminder.config.ReminderSchedulerProperties;
import com.carecircle.reminder.model.FamilyMember;
import com.carecircle.reminder.model.Medication;
import com.carecircle.reminder.model.ReminderDomain;
import com.carecircle.reminder.repository.FamilyMemberRepository;
import com.carecircle.reminder.repository.MedicationRepository;
import java.time.ZonedDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RefillAlertScanner implements ReminderScanner {

  private static final Logger logger = LoggerFactory.getLogger(RefillAlertScanner.class);

  private final MedicationRepository medicationRepository;
  private final FamilyMemberRepository familyMemberRepository;
  private final ReminderJobKeyBuilder keyBuilder;
  private final ReminderDispatcher dispatcher;
  private final ReminderSchedulerProperties properties;

  @Override
  public ReminderDomain domain() {
    return ReminderDomain.REFILL;
  }

  /**
   * 役割: 毎時 0 分の sweep でのみ残薬を確認する。
   * 動作: それ以外の分では DB を一切読まずに空の結果を返す。
   * 前提: 1 日のうち何度当たってもキーが日付単位なので投入は 1 回に収まる。
   */
  @Override
  public ScanReport scan(ZonedDateTime now) {
    final ScanReport report = new ScanReport(domain());
    if (now.getMinute() != 0) {
      return report;
    }
    for (Medication medication : medicationRepository.findRefillCandidates()) {
      try {
        enqueue(medication, now, report);
      } catch (RuntimeException ex) {
        report.recordFailure(new ScanFailure(medication.id(), null, ex));
      }
    }
    return report;
  }

  private void enqueue(Medication medication, ZonedDateTime now, ScanReport report) {
    final List<String> recipientUserIds =
        familyMemberRepository
            .findActiveByCareRecipient(
                medication.careRecipientId(), properties.refillRecipientRoles())
            .stream()
            .map(FamilyMember::userId)
            .toList();
    if (recipientUserIds.isEmpty()) {
      logger.debug(
          "refill alert skipped without recipients medicationId={} careRecipientId={}",
          medication.id(),
          medication.careRecipientId());
      report.recordSkipped();
      return;
    }
    final RefillAlertPayload payload =
        new RefillAlertPayload(
            medication.id(),
            medication.careRecipientId(),
            medication.name(),
            medication.currentSupply(),
            medication.refillAt(),
            recipientUserIds);
    dispatcher.dispatch(
        domain(),
        keyBuilder.refillKey(medication.id(), now.toLocalDate()),
        payload,
        medication.id(),
        null,
        report);
  }
}
