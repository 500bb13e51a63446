/*
 * どこで: Notification ドメインモデル
 * 何を: 永続ジョブの状態を定義する
 * なぜ: claim/retry/完了の遷移を列挙型で固定するため
 */
package com.devos.notification.model;

public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
