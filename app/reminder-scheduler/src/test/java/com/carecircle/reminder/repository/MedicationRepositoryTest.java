/*
 * どこで: MedicationRepository / MedicationLogRepository の統合テスト
 * 何を: TEXT[] の読み取り、残薬候補の絞り込み、服薬記録の分窓判定を検証する
 * なぜ: Prisma 所有のスキーマ(引用符付き識別子/UTC の TIMESTAMP)を正しく読めることを保証するため
 */
package com.carecircle.reminder.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.carecircle.reminder.AbstractPostgresContainerTest;
import com.carecircle.reminder.model.Medication;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class MedicationRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private MedicationRepository medicationRepository;
  @Autowired private MedicationLogRepository medicationLogRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    truncateCareTables(jdbcTemplate);
    insertCareRecipient(jdbcTemplate, "cr-1", "f-1");
    insertMedication("m-active", true, 20, 5);
    insertMedication("m-low", true, 3, 5);
    insertMedication("m-inactive", false, 1, 5);
    insertMedication("m-untracked", true, null, null);
  }

  @Test
  void findActiveReadsScheduledTimes() {
    final List<Medication> medications = medicationRepository.findActive();

    assertThat(medications)
        .extracting(Medication::id)
        .containsExactly("m-active", "m-low", "m-untracked");
    assertThat(medications.get(0).scheduledTimes()).containsExactly("08:00", "20:00");
    assertThat(medications.get(2).currentSupply()).isNull();
  }

  @Test
  void findRefillCandidatesReturnsActiveAtOrBelowThreshold() {
    assertThat(medicationRepository.findRefillCandidates())
        .extracting(Medication::id)
        .containsExactly("m-low");
  }

  @Test
  void logExistsOnlyWithinScheduledMinute() {
    jdbcTemplate.update(
        """
        INSERT INTO "MedicationLog" ("id", "medicationId", "scheduledTime", "status")
        VALUES ('log-1', 'm-active', :scheduledTime, 'GIVEN')
        """,
        new MapSqlParameterSource("scheduledTime", LocalDateTime.parse("2026-03-10T08:00:00")));

    assertThat(
            medicationLogRepository.existsForScheduledWindow(
                "m-active",
                Instant.parse("2026-03-10T08:00:00Z"),
                Instant.parse("2026-03-10T08:01:00Z")))
        .isTrue();
    assertThat(
            medicationLogRepository.existsForScheduledWindow(
                "m-active",
                Instant.parse("2026-03-10T20:00:00Z"),
                Instant.parse("2026-03-10T20:01:00Z")))
        .isFalse();
  }

  private void insertMedication(String id, boolean active, Integer supply, Integer refillAt) {
    jdbcTemplate.update(
        """
        INSERT INTO "Medication"
          ("id", "careRecipientId", "name", "dosage", "scheduledTimes",
           "currentSupply", "refillAt", "isActive")
        VALUES (:id, 'cr-1', 'Donepezil', '5mg', ARRAY['08:00', '20:00'],
                :supply, :refillAt, :active)
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("supply", supply, Types.INTEGER)
            .addValue("refillAt", refillAt, Types.INTEGER)
            .addValue("active", active));
  }
}
