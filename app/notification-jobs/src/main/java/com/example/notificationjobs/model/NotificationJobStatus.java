/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: ジョブのライフサイクル状態と許可される遷移を定義する
 * なぜ: 状態機械を SQL ガードと処理ロジックで共有する 1 箇所にまとめるため
 */
package com.example.notificationjobs.model;

import java.util.EnumSet;
import java.util.Set;

public enum NotificationJobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED,
  CANCELLED;

  private static final Set<NotificationJobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

  public boolean isTerminal() {
    return TERMINAL.contains(this);
  }

  /** 2 つの状態から到達できる遷移はキャンセルのみ。 */
  public boolean canTransitionTo(NotificationJobStatus target) {
    if (target == null || isTerminal()) {
      return false;
    }
    return switch (this) {
      case PENDING -> target == PROCESSING || target == CANCELLED;
      case PROCESSING ->
          target == COMPLETED || target == PENDING || target == FAILED || target == CANCELLED;
      default -> false;
    };
  }

  public static Set<NotificationJobStatus> terminalStatuses() {
    return EnumSet.copyOf(TERMINAL);
  }

  /** クエリパラメータ用の緩い解析。大文字小文字は問わない。 */
  public static NotificationJobStatus parse(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    for (NotificationJobStatus status : values()) {
      if (status.name().equalsIgnoreCase(value.trim())) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown notification job status: " + value);
  }
}
