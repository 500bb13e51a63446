/*
 * どこで: Notification ドメインモデル
 * 何を: 通知イベント種別と critical/immediate/consolidatable の分類を定義する
 * なぜ: 種別ごとの配信ルールを 1 箇所に固定するため
 */
package com.devos.notification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
  EPIC_COMPLETED("epic_completed", "epicCompletions", false, false, true),
  STORY_COMPLETED("story_completed", "storyCompletions", false, false, true),
  DEPLOYMENT_SUCCESS("deployment_success", "deploymentSuccess", false, false, false),
  DEPLOYMENT_FAILED("deployment_failed", "deploymentFailure", true, true, false),
  AGENT_ERROR("agent_error", "agentErrors", true, true, false),
  AGENT_MESSAGE("agent_message", "agentMessages", false, false, true),
  CONTEXT_DEGRADED("context_degraded", null, false, false, false),
  CONTEXT_CRITICAL("context_critical", null, false, true, false),
  DEPLOYMENT_PENDING_APPROVAL("deployment_pending_approval", null, false, true, false),
  AGENT_NEEDS_INPUT("agent_needs_input", null, false, true, false),
  AGENT_TASK_STARTED("agent_task_started", null, false, false, false),
  AGENT_TASK_COMPLETED("agent_task_completed", null, false, false, true),
  COST_ALERT_WARNING("cost_alert_warning", null, false, false, false),
  COST_ALERT_EXCEEDED("cost_alert_exceeded", null, false, true, false),
  SPRINT_REVIEW_READY("sprint_review_ready", null, false, false, false);

  private final String value;
  private final String settingKey;
  private final boolean critical;
  private final boolean immediate;
  private final boolean consolidatable;

  NotificationType(
      String value, String settingKey, boolean critical, boolean immediate, boolean consolidatable) {
    this.value = value;
    this.settingKey = settingKey;
    this.critical = critical;
    this.immediate = immediate;
    this.consolidatable = consolidatable;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** eventSettings 上のキー。対応するトグルが無い種別は null。 */
  public String settingKey() {
    return settingKey;
  }

  /** 設定で無効化できず、quiet hours も常に素通りする種別。 */
  public boolean isCritical() {
    return critical;
  }

  /** batchable 指定に関わらずバッチを経由せず即時送信する種別。critical を含む。 */
  public boolean isImmediate() {
    return immediate;
  }

  public boolean isConsolidatable() {
    return consolidatable;
  }

  /** 表示用に "_" を空白へ置き換えた名前を返す。 */
  public String displayName() {
    return value.replace('_', ' ');
  }

  /**
   * 役割: ワイヤ上の種別文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  @JsonCreator
  public static NotificationType fromValue(String type) {
    for (NotificationType notificationType : values()) {
      if (notificationType.value.equalsIgnoreCase(type)) {
        return notificationType;
      }
    }
    throw new IllegalArgumentException("unsupported notification type: " + type);
  }
}
