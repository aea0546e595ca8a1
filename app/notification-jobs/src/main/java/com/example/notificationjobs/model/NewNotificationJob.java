/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: ジョブ登録時に呼び出し側が渡す項目を表す
 * なぜ: 登録の契約と保存行 (id/attempts/status は採番側で決める) を分けるため
 */
package com.example.notificationjobs.model;

import java.time.Instant;

/**
 * ジョブ登録の入力。
 *
 * @param maxAttempts {@code null} の場合は設定の既定値を使う
 */
public record NewNotificationJob(
    String title,
    String body,
    String payloadJson,
    NotificationTarget target,
    Instant scheduledTime,
    String createdBy,
    Integer maxAttempts) {}
