/*
 * どこで: 共通ユーティリティ
 * 何を: Instant と TIMESTAMP(3)(タイムゾーンなし) 列の値を相互変換する
 * なぜ: Prisma 管理のスキーマは UTC の壁時計値を保存しており、JVM のタイムゾーンに依存せず読み書きするため
 */
package com.carecircle.common;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: 列の値は UTC の壁時計。java.sql.Timestamp を経由すると JVM の既定ゾーンで解釈されるため使わない
  public static LocalDateTime toUtcDateTime(Instant instant) {
    return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  public static Instant fromUtcDateTime(LocalDateTime value) {
    return value == null ? null : value.toInstant(ZoneOffset.UTC);
  }
}
