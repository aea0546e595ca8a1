/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: 通知の宛先 (指定ユーザーまたは全ユーザー) を表す
 * なぜ: すべてのジョブで宛先の指定方法をちょうど 1 つにするため
 */
package com.example.notificationjobs.model;

import java.util.List;

public record NotificationTarget(List<String> userIds, boolean allUsers) {

  public NotificationTarget {
    userIds = userIds == null ? List.of() : List.copyOf(userIds);
    if (allUsers && !userIds.isEmpty()) {
      throw new IllegalArgumentException("target must be either user ids or all users, not both");
    }
    if (!allUsers && userIds.isEmpty()) {
      throw new IllegalArgumentException("target requires at least one user id or all users");
    }
  }

  public static NotificationTarget users(List<String> userIds) {
    return new NotificationTarget(userIds, false);
  }

  public static NotificationTarget broadcast() {
    return new NotificationTarget(List.of(), true);
  }
}
