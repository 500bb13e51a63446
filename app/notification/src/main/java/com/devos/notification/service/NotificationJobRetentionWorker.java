/*
 * どこで: Notification ジョブ掃除ワーカー
 * 何を: 完了/失敗済みジョブの削除をスケジュールで起動する
 * なぜ: 手作業なしで notification_jobs の肥大化を防ぐため
 */
package com.devos.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationJobRetentionWorker {

  private final NotificationJobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${notification.delivery.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
