/*
 * どこで: common のジョブ payload 定義
 * 何を: refill-alerts キューに載せる残薬アラートの形状
 * なぜ: 通知先の家族メンバーをワーカー側で再検索させないため、宛先 ID を同梱する
 */
package com.carecircle.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RefillAlertPayload(
    String medicationId,
    String careRecipientId,
    String medicationName,
    int currentSupply,
    int refillAt,
    List<String> recipientUserIds) {

  public RefillAlertPayload {
    recipientUserIds = recipientUserIds == null ? List.of() : List.copyOf(recipientUserIds);
  }
}
