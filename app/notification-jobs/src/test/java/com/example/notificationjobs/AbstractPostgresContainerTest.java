/*
 * どこで: NotificationJobs テスト基盤
 * 何を: Testcontainers の Postgres と DataSource/Flyway の接続設定を共有する
 * なぜ: repository と end-to-end テストを本番と同じマイグレーションで動かすため
 */
package com.example.notificationjobs;

import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

public abstract class AbstractPostgresContainerTest {

  // JVM ごとにコンテナは 1 つとし、Spring のコンテキストキャッシュをテストクラス間で共有する
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  static {
    // @DynamicPropertySource は JUnit 拡張によるコンテナ起動より先に評価されうるため static で起動する
    POSTGRES.start();
  }

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.datasource.hikari.schema", () -> "notification_jobs");

    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
    registry.add("spring.flyway.default-schema", () -> "notification_jobs");
    registry.add("spring.flyway.schemas", () -> "notification_jobs");
    registry.add("spring.flyway.create-schemas", () -> "true");
    registry.add("spring.flyway.table", () -> "flyway_schema_history_notification_jobs");
  }
}
