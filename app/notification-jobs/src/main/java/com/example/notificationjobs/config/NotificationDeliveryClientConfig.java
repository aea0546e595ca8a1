/*
 * どこで: NotificationJobs 配信設定
 * 何を: HTTP sender が使う RestClient を組み立てる
 * なぜ: base URL とタイムアウトを sender 本体から切り離すため
 */
package com.example.notificationjobs.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "notification.jobs.delivery.mode", havingValue = "http")
public class NotificationDeliveryClientConfig {

  @Bean
  RestClient notificationDeliveryRestClient(
      RestClient.Builder builder, NotificationJobDeliveryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }
}
