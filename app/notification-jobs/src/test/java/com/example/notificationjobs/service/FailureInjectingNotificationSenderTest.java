package com.example.notificationjobs.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.NotificationTarget;
import java.lang.reflect.Field;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class FailureInjectingNotificationSenderTest {

  @Test
  void sendThrowsWhenCreatorMatchesPrefix() {
    final LocalNotificationSender delegate = mock(LocalNotificationSender.class);
    final FailureInjectingNotificationSender sender =
        new FailureInjectingNotificationSender(delegate);
    setCreatedByPrefix(sender, "e2e-fail-");

    assertThatThrownBy(() -> sender.send(job("e2e-fail-admin")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failure injection");
  }

  @Test
  void sendDelegatesWhenCreatorDoesNotMatch() {
    final LocalNotificationSender delegate = mock(LocalNotificationSender.class);
    final FailureInjectingNotificationSender sender =
        new FailureInjectingNotificationSender(delegate);
    setCreatedByPrefix(sender, "e2e-fail-");
    final NotificationJob job = job("admin-1");

    assertThatCode(() -> sender.send(job)).doesNotThrowAnyException();

    verify(delegate).send(job);
  }

  @Test
  void sendDelegatesWhenPrefixIsBlank() {
    final LocalNotificationSender delegate = mock(LocalNotificationSender.class);
    final FailureInjectingNotificationSender sender =
        new FailureInjectingNotificationSender(delegate);
    setCreatedByPrefix(sender, "");
    final NotificationJob job = job("e2e-fail-admin");

    sender.send(job);

    verify(delegate).send(job);
  }

  private void setCreatedByPrefix(FailureInjectingNotificationSender sender, String prefix) {
    try {
      final Field field =
          FailureInjectingNotificationSender.class.getDeclaredField("createdByPrefix");
      field.setAccessible(true);
      field.set(sender, prefix);
    } catch (ReflectiveOperationException ex) {
      throw new AssertionError("failed to set createdByPrefix for test setup", ex);
    }
  }

  private NotificationJob job(String createdBy) {
    final Instant now = Instant.parse("2026-01-17T00:00:00Z");
    return new NotificationJob(
        "job-1",
        "title",
        "body",
        "{}",
        NotificationTarget.broadcast(),
        now,
        now,
        createdBy,
        1,
        3,
        NotificationJobStatus.PROCESSING,
        null,
        null,
        null);
  }
}
