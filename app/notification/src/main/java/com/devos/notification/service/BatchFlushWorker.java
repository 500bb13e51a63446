package com.devos.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.batch.enabled", havingValue = "true")
public class BatchFlushWorker {

  private final BatchFlushService batchFlushService;

  @Scheduled(
      fixedDelayString = "${notification.batch.flush-interval}",
      initialDelayString = "${notification.batch.flush-interval}")
  public void run() {
    batchFlushService.flushAll();
  }
}
