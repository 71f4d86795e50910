/*
 * どこで: Reminder Scheduler データアクセス
 * 何を: MedicationLog の存在確認を行う
 * なぜ: 既に記録済み(投与/スキップ/未投与)の服薬にリマインダーを送らないため
 */
package com.carecircle.reminder.repository;

import static com.carecircle.common.JdbcTimestampUtils.toUtcDateTime;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MedicationLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** [from, to) に scheduledTime を持つログが 1 件でもあれば true。 */
  public boolean existsForScheduledWindow(String medicationId, Instant from, Instant to) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM "MedicationLog"
          WHERE "medicationId" = :medicationId
            AND "scheduledTime" >= :from
            AND "scheduledTime" < :to
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("medicationId", medicationId)
            .addValue("from", toUtcDateTime(from))
            .addValue("to", toUtcDateTime(to));
    final Boolean exists = jdbcTemplate.queryForObject(sql, params, Boolean.class);
    return Boolean.TRUE.equals(exists);
  }
}
