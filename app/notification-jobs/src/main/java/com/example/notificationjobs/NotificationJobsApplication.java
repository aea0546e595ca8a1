/*
 * どこで: NotificationJobs サービスのエントリポイント
 * 何を: Spring を起動し、設定プロパティの走査とスケジューリングを有効にする
 * なぜ: janitor は @Scheduled、processor ループは共有の TaskScheduler に依存するため
 */
package com.example.notificationjobs;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class NotificationJobsApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotificationJobsApplication.class, args);
  }
}
