package com.devos.notification.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/**
 * notification.events で受け取る JSON。recipients が空なら scope から受信者を解決する。
 * type と urgency は未知の値を恒久エラーとして扱うため文字列のまま受ける。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundNotificationMessage(
    String type,
    Map<String, Object> payload,
    List<Recipient> recipients,
    RecipientScope scope,
    String urgency,
    Boolean batchable) {}
