/*
 * どこで: Reminder Scheduler データアクセス
 * 何を: 期間と状態で CaregiverShift を絞り込んで取得する
 * なぜ: シフト開始リマインダーの走査対象を先読み窓の中だけに限定するため
 */
package com.carecircle.reminder.repository;

import static com.carecircle.common.JdbcTimestampUtils.fromUtcDateTime;
import static com.carecircle.common.JdbcTimestampUtils.toUtcDateTime;

import com.carecircle.reminder.model.CaregiverShift;
import com.carecircle.reminder.model.ShiftStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CaregiverShiftRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<CaregiverShift> findStartingBetween(Instant from, Instant to, ShiftStatus status) {
    final String sql =
        """
        SELECT "id", "careRecipientId", "caregiverId", "startTime", "status"::text AS status
        FROM "CaregiverShift"
        WHERE "startTime" >= :from
          AND "startTime" <= :to
          AND "status"::text = :status
        ORDER BY "startTime", "id"
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toUtcDateTime(from))
            .addValue("to", toUtcDateTime(to))
            .addValue("status", status.name());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CaregiverShift mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CaregiverShift(
        rs.getString("id"),
        rs.getString("careRecipientId"),
        rs.getString("caregiverId"),
        fromUtcDateTime(rs.getObject("startTime", LocalDateTime.class)),
        ShiftStatus.valueOf(rs.getString("status")));
  }
}
