/*
 * どこで: NotificationJobs ドメインモデル
 * 何を: ジョブに付随する任意の配信項目 (icon, actions, tag など) を保持する
 * なぜ: キューは不透明な JSON として保存し、解釈するのは sender だけにするため
 */
package com.example.notificationjobs.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "JsonNode data is treated as read-only once the payload is built")
public record NotificationPayload(
    String icon,
    String badge,
    String image,
    JsonNode data,
    List<NotificationAction> actions,
    String tag,
    Boolean requireInteraction,
    Boolean silent,
    List<Integer> vibrate) {

  public NotificationPayload {
    actions = actions == null ? null : List.copyOf(actions);
    vibrate = vibrate == null ? null : List.copyOf(vibrate);
  }

  public static NotificationPayload empty() {
    return new NotificationPayload(null, null, null, null, null, null, null, null, null);
  }
}
