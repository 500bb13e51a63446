/*
 * どこで: Notification ジョブワーカー
 * 何を: スケジュールで永続ジョブキューの処理を起動する
 * なぜ: 再送ジョブを一定間隔で処理するため
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
public class NotificationJobWorker {

  private final NotificationJobQueue jobQueue;

  @Scheduled(fixedDelayString = "${notification.delivery.poll-interval}")
  public void run() {
    jobQueue.processPendingBatch();
  }
}
