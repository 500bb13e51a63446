/*
 * どこで: Notification ドメインモデル
 * 何を: 配信対象となる正規化済みイベントを表す
 * なぜ: dispatch 以降で受け渡す不変の入力を固定するため
 */
package com.devos.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record NotificationEvent(
    NotificationType type,
    Map<String, Object> payload,
    List<Recipient> recipients,
    NotificationUrgency urgency,
    boolean batchable) {

  public NotificationEvent {
    Objects.requireNonNull(type, "type");
    // payload は null 値を含み得るため Map.copyOf は使わない
    payload =
        payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    urgency = urgency == null ? NotificationUrgency.NORMAL : urgency;
  }

  /** 受信者だけを差し替えた同一イベントを返す。 */
  public NotificationEvent withRecipients(List<Recipient> filteredRecipients) {
    return new NotificationEvent(type, payload, filteredRecipients, urgency, batchable);
  }
}
