/*
 * どこで: Reminder Scheduler サービス層
 * 何を: リマインダー時刻が今回の sweep の 1 分窓に入っているかを判定する
 * なぜ: sweep を状態なしで何度実行しても、各リマインダーが発火する tick を 1 つに定めるため
 */
package com.carecircle.reminder.service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

public final class DueWindow {

  public static final Duration WIDTH = Duration.ofMinutes(1);

  private DueWindow() {}

  /**
   * 役割: candidate の属する分に now が入っているかを返す。
   * 動作: [floor(candidate), floor(candidate) + 1 分) に now があれば true。
   * 前提: sweep 間隔は 1 分以下。窓を丸ごと飛び越えた tick は取りこぼす(後追い送信はしない)。
   */
  public static boolean isDue(Instant now, Instant candidate) {
    final Instant start = startOf(candidate);
    return !now.isBefore(start) && now.isBefore(start.plus(WIDTH));
  }

  public static Instant startOf(Instant instant) {
    return instant.truncatedTo(ChronoUnit.MINUTES);
  }

  /** 窓の終端(排他)。 */
  public static Instant endOf(Instant instant) {
    return startOf(instant).plus(WIDTH);
  }
}
