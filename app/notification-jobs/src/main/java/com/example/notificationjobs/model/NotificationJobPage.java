package com.example.notificationjobs.model;

import java.util.List;

public record NotificationJobPage(List<NotificationJob> jobs, long total) {

  public NotificationJobPage {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
