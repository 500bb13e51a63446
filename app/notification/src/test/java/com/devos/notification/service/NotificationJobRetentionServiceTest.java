package com.devos.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.devos.notification.config.NotificationDeliveryProperties;
import com.devos.notification.repository.NotificationJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationJobRetentionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private NotificationJobRepository jobRepository;

  @Test
  void deletesFinishedJobsOlderThanRetentionDays() {
    final NotificationDeliveryProperties properties =
        new NotificationDeliveryProperties(
            true,
            Duration.ofSeconds(1),
            50,
            3,
            Duration.ofSeconds(5),
            Duration.ofMinutes(5),
            2.0d,
            0.8d,
            1.2d,
            Duration.ofSeconds(1),
            1000,
            Duration.ofSeconds(30),
            7,
            Duration.ofHours(1));
    final Instant threshold = Instant.parse("2026-01-10T00:00:00Z");
    when(jobRepository.deleteFinishedOlderThan(threshold)).thenReturn(4);
    final NotificationJobRetentionService service =
        new NotificationJobRetentionService(
            jobRepository, properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));

    assertThat(service.cleanup()).isEqualTo(4);

    verify(jobRepository).deleteFinishedOlderThan(threshold);
  }
}
