/*
 * どこで: NotificationJobs サービス層
 * 何を: notif_<epochMillis>_<36 進ランダム接尾辞> 形式のジョブ ID を生成する
 * なぜ: ID は一意であればよく、時刻接頭辞でおおよその並び順を保つため
 */
package com.example.notificationjobs.service;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationJobIdGenerator {

  static final String PREFIX = "notif_";
  static final int SUFFIX_LENGTH = 9;
  private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

  private final Clock clock;

  public String newJobId() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final StringBuilder builder = new StringBuilder(PREFIX).append(clock.millis()).append('_');
    for (int i = 0; i < SUFFIX_LENGTH; i++) {
      builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return builder.toString();
  }
}
