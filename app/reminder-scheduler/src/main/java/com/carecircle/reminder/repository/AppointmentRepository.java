/*
 * どこで: Reminder Scheduler データアクセス
 * 何を: 期間と状態で Appointment を絞り込んで取得する
 * なぜ: 毎 tick でテーブル全体を走査しないよう、先読み窓の中だけを読むため
 */
package com.carecircle.reminder.repository;

import static com.carecircle.common.JdbcTimestampUtils.fromUtcDateTime;
import static com.carecircle.common.JdbcTimestampUtils.toUtcDateTime;

import com.carecircle.reminder.model.Appointment;
import com.carecircle.reminder.model.AppointmentStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AppointmentRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Appointment> findStartingBetween(
      Instant from, Instant to, Collection<AppointmentStatus> statuses) {
    if (statuses.isEmpty()) {
      return List.of();
    }
    // status は Postgres の enum 型なので text にキャストしてから比較する
    final String sql =
        """
        SELECT "id", "careRecipientId", "title", "location", "startTime", "status"::text AS status
        FROM "Appointment"
        WHERE "startTime" >= :from
          AND "startTime" <= :to
          AND "status"::text IN (:statuses)
        ORDER BY "startTime", "id"
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toUtcDateTime(from))
            .addValue("to", toUtcDateTime(to))
            .addValue("statuses", statuses.stream().map(Enum::name).toList());
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private Appointment mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Appointment(
        rs.getString("id"),
        rs.getString("careRecipientId"),
        rs.getString("title"),
        rs.getString("location"),
        fromUtcDateTime(rs.getObject("startTime", LocalDateTime.class)),
        AppointmentStatus.valueOf(rs.getString("status")));
  }
}
