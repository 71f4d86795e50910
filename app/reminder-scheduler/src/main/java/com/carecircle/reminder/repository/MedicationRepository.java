/*
 * どこで: Reminder Scheduler データアクセス
 * 何を: 有効な Medication と残薬アラート候補を取得する
 * なぜ: 服薬リマインダーと残薬アラートの走査対象を DB から得るため
 */
package com.carecircle.reminder.repository;

import com.carecircle.reminder.model.Medication;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MedicationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Medication> findActive() {
    final String sql =
        """
        SELECT "id", "careRecipientId", "name", "dosage", "scheduledTimes",
               "currentSupply", "refillAt"
        FROM "Medication"
        WHERE "isActive" = true
        ORDER BY "id"
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<Medication> findRefillCandidates() {
    // 供給量と閾値の両方が入っている行だけを対象にし、比較も DB 側で済ませる
    final String sql =
        """
        SELECT "id", "careRecipientId", "name", "dosage", "scheduledTimes",
               "currentSupply", "refillAt"
        FROM "Medication"
        WHERE "isActive" = true
          AND "currentSupply" IS NOT NULL
          AND "refillAt" IS NOT NULL
          AND "currentSupply" <= "refillAt"
        ORDER BY "id"
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private Medication mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Medication(
        rs.getString("id"),
        rs.getString("careRecipientId"),
        rs.getString("name"),
        rs.getString("dosage"),
        readTextArray(rs.getArray("scheduledTimes")),
        rs.getObject("currentSupply", Integer.class),
        rs.getObject("refillAt", Integer.class));
  }

  private List<String> readTextArray(Array array) throws SQLException {
    if (array == null) {
      return List.of();
    }
    try {
      final Object[] values = (Object[]) array.getArray();
      return Arrays.stream(values).map(String::valueOf).toList();
    } finally {
      array.free();
    }
  }
}
