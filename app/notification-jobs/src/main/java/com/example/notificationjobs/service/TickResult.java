/*
 * どこで: NotificationJobs サービス層
 * 何を: processor の 1 tick の結果件数を表す
 * なぜ: ライフサイクル制御がこの件数からアイドル自動停止を判断するため
 */
package com.example.notificationjobs.service;

/**
 * @param skipped 別の tick が実行中で何も claim しなかった
 * @param claimed claim クエリが返したジョブ数。並行キャンセルで失ったものを含む
 * @param abandoned 結果を書く前に保存行が PROCESSING から外れたジョブ数
 */
public record TickResult(
    boolean skipped, int claimed, int completed, int retried, int failed, int abandoned) {

  public static TickResult skippedTick() {
    return new TickResult(true, 0, 0, 0, 0, 0);
  }

  public boolean isIdle() {
    return !skipped && claimed == 0;
  }
}
