package com.example.notificationjobs.service;

public class NotificationJobNotFoundException extends RuntimeException {

  public NotificationJobNotFoundException(String jobId) {
    super("notification job not found: " + jobId);
  }
}
