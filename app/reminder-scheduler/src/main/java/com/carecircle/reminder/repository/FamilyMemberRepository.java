/*
 * どこで: Reminder Scheduler データアクセス
 * 何を: 被介護者の家族に属する有効メンバーを取得する
 * なぜ: 残薬アラートの宛先を決めるため
 */
package com.carecircle.reminder.repository;

import com.carecircle.reminder.model.FamilyMember;
import com.carecircle.reminder.model.FamilyRole;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class FamilyMemberRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<FamilyMember> findActiveByCareRecipient(
      String careRecipientId, Collection<FamilyRole> roles) {
    if (roles.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT fm."userId", fm."role"::text AS role
        FROM "FamilyMember" fm
        JOIN "CareRecipient" cr ON cr."familyId" = fm."familyId"
        WHERE cr."id" = :careRecipientId
          AND fm."isActive" = true
          AND fm."role"::text IN (:roles)
        ORDER BY fm."joinedAt", fm."userId"
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("careRecipientId", careRecipientId)
            .addValue("roles", roles.stream().map(Enum::name).toList());
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new FamilyMember(rs.getString("userId"), FamilyRole.valueOf(rs.getString("role"))));
  }
}
