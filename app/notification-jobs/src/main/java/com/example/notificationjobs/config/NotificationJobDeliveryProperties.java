/*
 * どこで: NotificationJobs 設定バインド
 * 何を: 配信 sender の選択と HTTP 送信先を保持する
 * なぜ: キューは受け渡しだけを行い、送り先は環境ごとに決めるため
 */
package com.example.notificationjobs.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.jobs.delivery")
public record NotificationJobDeliveryProperties(
    String mode, String baseUrl, String sendPath, Duration timeout) {

  public static final String MODE_LOCAL = "local";
  public static final String MODE_HTTP = "http";

  public NotificationJobDeliveryProperties {
    mode = mode == null || mode.isBlank() ? MODE_LOCAL : mode;
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:3000" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/api/notifications/send" : sendPath;
    timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
  }
}
