package com.devos.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class NotificationRateLimitPropertiesValidationTest {

  private final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

  @Test
  void retentionLongerThanWindowIsValid() {
    final NotificationRateLimitProperties properties =
        new NotificationRateLimitProperties(Duration.ofSeconds(60), Duration.ofSeconds(120), 30);

    assertThat(validator.validate(properties)).isEmpty();
  }

  @Test
  void retentionShorterThanWindowIsRejected() {
    final NotificationRateLimitProperties properties =
        new NotificationRateLimitProperties(Duration.ofSeconds(60), Duration.ofSeconds(30), 30);

    assertThat(validator.validate(properties))
        .extracting(violation -> violation.getMessage())
        .containsExactly("notification.rate-limit.retention must not be shorter than window");
  }

  @Test
  void nonPositiveDefaultLimitIsRejected() {
    final NotificationRateLimitProperties properties =
        new NotificationRateLimitProperties(Duration.ofSeconds(60), Duration.ofSeconds(120), 0);

    assertThat(validator.validate(properties)).isNotEmpty();
  }
}
