/*
 * どこで: NotificationJobs サービス層
 * 何を: ジョブの payload を内部の送信エンドポイントへ POST する sender
 * なぜ: プッシュ送信の実体はエンドポイントの先にあり、キューは受け渡しだけを行うため
 */
package com.example.notificationjobs.service;

import com.example.notificationjobs.config.NotificationJobDeliveryProperties;
import com.example.notificationjobs.model.NotificationJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Component
@ConditionalOnProperty(name = "notification.jobs.delivery.mode", havingValue = "http")
public class HttpNotificationSender implements NotificationSender {

  static final String HEADER_SYSTEM_JOB = "X-System-Job";
  static final String HEADER_JOB_ID = "X-Job-Id";

  private static final Logger logger = LoggerFactory.getLogger(HttpNotificationSender.class);
  private static final int MAX_ERROR_BODY_LENGTH = 500;

  private final RestClient notificationDeliveryRestClient;
  private final NotificationJobDeliveryProperties properties;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient and ObjectMapper are shared Spring-managed components")
  public HttpNotificationSender(
      RestClient notificationDeliveryRestClient,
      NotificationJobDeliveryProperties properties,
      ObjectMapper objectMapper) {
    this.notificationDeliveryRestClient = notificationDeliveryRestClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public void send(NotificationJob job) {
    final ObjectNode body = buildRequestBody(job);
    try {
      notificationDeliveryRestClient
          .post()
          .uri(properties.sendPath())
          .contentType(MediaType.APPLICATION_JSON)
          .header(HEADER_SYSTEM_JOB, "true")
          .header(HEADER_JOB_ID, job.jobId())
          .body(body)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(job, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(job, ex);
    }
    logger.info("notification job delivered id={}", job.jobId());
  }

  ObjectNode buildRequestBody(NotificationJob job) {
    final ObjectNode body = readPayload(job);
    body.put("title", job.title());
    body.put("body", job.body());
    if (job.target().allUsers()) {
      body.put("allUsers", true);
    } else {
      final ArrayNode userIds = body.putArray("userIds");
      job.target().userIds().forEach(userIds::add);
      body.put("allUsers", false);
    }
    return body;
  }

  private ObjectNode readPayload(NotificationJob job) {
    if (job.payloadJson() == null || job.payloadJson().isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      final JsonNode node = objectMapper.readTree(job.payloadJson());
      if (node instanceof ObjectNode objectNode) {
        return objectNode;
      }
      throw new NotificationDeliveryException(
          NotificationDeliveryException.Reason.INVALID_PAYLOAD,
          "notification payload is not a JSON object id=" + job.jobId());
    } catch (JsonProcessingException ex) {
      throw new NotificationDeliveryException(
          NotificationDeliveryException.Reason.INVALID_PAYLOAD,
          "notification payload parse failure id=" + job.jobId(),
          ex);
    }
  }

  private NotificationDeliveryException mapResponseException(
      NotificationJob job, RestClientResponseException ex) {
    logger.warn(
        "notification send endpoint rejected job id={} status={}",
        job.jobId(),
        ex.getStatusCode().value());
    final String responseBody = abbreviate(ex.getResponseBodyAsString());
    if (ex.getStatusCode().is5xxServerError()) {
      return new NotificationDeliveryException(
          NotificationDeliveryException.Reason.BAD_GATEWAY,
          "Failed to send notification: " + responseBody,
          ex);
    }
    return new NotificationDeliveryException(
        NotificationDeliveryException.Reason.REJECTED,
        "Failed to send notification: " + responseBody,
        ex);
  }

  private NotificationDeliveryException mapResourceException(
      NotificationJob job, ResourceAccessException ex) {
    if (ex.getCause() instanceof SocketTimeoutException) {
      logger.warn("notification send endpoint timed out id={}", job.jobId());
      return new NotificationDeliveryException(
          NotificationDeliveryException.Reason.TIMEOUT, "notification send timed out", ex);
    }
    logger.warn("notification send endpoint unreachable id={}", job.jobId());
    return new NotificationDeliveryException(
        NotificationDeliveryException.Reason.BAD_GATEWAY, "notification send endpoint unreachable", ex);
  }

  private String abbreviate(String value) {
    if (value == null || value.isBlank()) {
      return "empty response";
    }
    return value.length() <= MAX_ERROR_BODY_LENGTH ? value : value.substring(0, MAX_ERROR_BODY_LENGTH);
  }
}
