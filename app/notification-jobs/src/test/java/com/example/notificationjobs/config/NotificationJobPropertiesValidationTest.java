package com.example.notificationjobs.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationJobPropertiesValidationTest {

  private Validator validator;

  @BeforeEach
  void setUp() {
    validator = Validation.buildDefaultValidatorFactory().getValidator();
  }

  @Test
  void processorDefaultsAreValid() {
    assertThat(validator.validate(processor(Duration.ofSeconds(30), Duration.ZERO, 5))).isEmpty();
  }

  @Test
  void processorRejectsNegativePollInterval() {
    assertThat(validator.validate(processor(Duration.ofSeconds(-1), Duration.ZERO, 5))).isNotEmpty();
  }

  @Test
  void processorRejectsZeroBatchSize() {
    assertThat(validator.validate(processor(Duration.ofSeconds(30), Duration.ZERO, 0))).isNotEmpty();
  }

  @Test
  void processorRejectsBackoffMaxBelowBase() {
    assertThat(validator.validate(processor(Duration.ofSeconds(30), Duration.ofHours(2), 5)))
        .isNotEmpty();
  }

  @Test
  void queueRejectsDefaultAboveLimit() {
    assertThat(validator.validate(new NotificationJobQueueProperties(3, 10, 0))).isEmpty();
    assertThat(validator.validate(new NotificationJobQueueProperties(11, 10, 0))).isNotEmpty();
    assertThat(validator.validate(new NotificationJobQueueProperties(3, 10, -1))).isNotEmpty();
  }

  @Test
  void retentionRejectsWindowAboveMax() {
    assertThat(
            validator.validate(
                new NotificationJobRetentionProperties(true, 30, 365, Duration.ofHours(24))))
        .isEmpty();
    assertThat(
            validator.validate(
                new NotificationJobRetentionProperties(true, 400, 365, Duration.ofHours(24))))
        .isNotEmpty();
    assertThat(
            validator.validate(new NotificationJobRetentionProperties(true, 30, 365, Duration.ZERO)))
        .isNotEmpty();
  }

  private static NotificationJobProcessorProperties processor(
      Duration pollInterval, Duration backoffBase, int batchSize) {
    return new NotificationJobProcessorProperties(
        true,
        pollInterval,
        batchSize,
        40,
        true,
        true,
        false,
        1000,
        backoffBase,
        Duration.ofHours(1),
        2.0d);
  }
}
