package com.devos.notification.service;

import com.devos.notification.model.NotificationType;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * 通知の見出しと本文をプレーンテキストで組み立てる。チャネル固有の装飾は扱わない。
 */
@Component
public class NotificationMessageFormatter {

  private static final List<String> TITLE_KEYS =
      List.of("title", "storyTitle", "epicTitle", "projectName");
  private static final List<String> BODY_KEYS =
      List.of("message", "summary", "description", "error", "errorMessage");

  public String title(NotificationType type, Map<String, Object> payload) {
    return title(type.value(), payload);
  }

  public String title(String type, Map<String, Object> payload) {
    final String explicit = firstText(payload, TITLE_KEYS);
    if (explicit != null) {
      return explicit;
    }
    final String words = type.replace('_', ' ');
    return Character.toUpperCase(words.charAt(0)) + words.substring(1);
  }

  public String body(Map<String, Object> payload) {
    final String body = firstText(payload, BODY_KEYS);
    return body == null ? "" : body;
  }

  /** webhook 向けの 1 メッセージ (見出し + 本文)。 */
  public String text(NotificationType type, Map<String, Object> payload) {
    final String title = title(type, payload);
    final String body = body(payload);
    return body.isEmpty() ? title : title + "\n" + body;
  }

  private String firstText(Map<String, Object> payload, List<String> keys) {
    if (payload == null) {
      return null;
    }
    for (String key : keys) {
      final Object value = payload.get(key);
      if (value != null && !String.valueOf(value).isBlank()) {
        return String.valueOf(value);
      }
    }
    return null;
  }
}
