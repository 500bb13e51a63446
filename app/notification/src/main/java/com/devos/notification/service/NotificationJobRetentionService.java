package com.devos.notification.service;

import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** 保持期間を過ぎた COMPLETED / FAILED ジョブを削除する。PENDING と PROCESSING は残す。 */
@Service
@RequiredArgsConstructor
public class NotificationJobRetentionService {

  private static final Logger logger =
      LoggerFactory.getLogger(NotificationJobRetentionService.class);

  private final NotificationJobRepository jobRepository;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = jobRepository.deleteFinishedOlderThan(threshold);
    logger.info("notification job retention deleted jobs={} threshold={}", deleted, threshold);
    return deleted;
  }
}
