package com.devos.notification.model;

import java.time.Instant;
import java.util.Map;

/**
 * バッチを種別ごとに畳み込んだ結果。集約された場合の type は {@code <type>_batch} になり、
 * payload に count と代表タイトルを持つ。
 */
public record ConsolidatedNotification(
    String type, Map<String, Object> payload, String workspaceId, Instant timestamp) {

  public int count() {
    final Object count = payload.get("count");
    return count instanceof Number number ? number.intValue() : 1;
  }
}
