package com.devos.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.quiet-hours.enabled", havingValue = "true")
public class QuietHoursFlushWorker {

  private final QuietHoursFlushService quietHoursFlushService;

  @Scheduled(fixedDelayString = "${notification.quiet-hours.flush-interval}")
  public void run() {
    quietHoursFlushService.flushEndedWindows();
  }
}
