/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: processor ライフサイクル制御のある時点の状態を表す
 * なぜ: 管理 API に公開するが、プロセス内の値でありレプリカ間では正ではないため
 */
package com.example.notificationjobs.model;

import java.time.Instant;

public record ProcessorStatus(
    boolean running,
    long intervalMillis,
    int idleTicks,
    int idleStopTicks,
    boolean startOnDemand,
    Instant lastTickAt,
    Instant lastProcessedAt,
    String lastError) {}
