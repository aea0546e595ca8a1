/*
 * どこで: NotificationJobs API
 * 何を: ジョブの予約/参照/キャンセル/クリーンアップと processor の start/stop を提供する
 * なぜ: キューの登録契約と運用契約を HTTP に結び付けるため
 */
package com.example.notificationjobs.api;

import com.example.notificationjobs.api.request.CancelNotificationJobsRequest;
import com.example.notificationjobs.api.request.CreateNotificationJobRequest;
import com.example.notificationjobs.api.request.NotificationActionRequest;
import com.example.notificationjobs.api.response.CancelNotificationJobResponse;
import com.example.notificationjobs.api.response.CancelNotificationJobsResponse;
import com.example.notificationjobs.api.response.CleanupResponse;
import com.example.notificationjobs.api.response.CreateNotificationJobResponse;
import com.example.notificationjobs.api.response.NotificationJobListResponse;
import com.example.notificationjobs.api.response.NotificationJobResponse;
import com.example.notificationjobs.api.response.NotificationJobStatsResponse;
import com.example.notificationjobs.api.response.PaginationResponse;
import com.example.notificationjobs.api.response.ProcessorCommandResponse;
import com.example.notificationjobs.api.response.ProcessorStatusResponse;
import com.example.notificationjobs.model.NewNotificationJob;
import com.example.notificationjobs.model.NotificationAction;
import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobFilter;
import com.example.notificationjobs.model.NotificationJobPage;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.NotificationPayload;
import com.example.notificationjobs.model.NotificationTarget;
import com.example.notificationjobs.service.InvalidNotificationJobRequestException;
import com.example.notificationjobs.service.NotificationJobProcessorController;
import com.example.notificationjobs.service.NotificationJobQueueService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notification-jobs")
@RequiredArgsConstructor
public class NotificationJobController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private static final int MAX_PAGE_SIZE = 100;

  private final NotificationJobQueueService queueService;
  private final NotificationJobProcessorController processorController;
  private final ObjectMapper objectMapper;

  @PostMapping
  public ResponseEntity<CreateNotificationJobResponse> createJob(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody CreateNotificationJobRequest request) {
    final NewNotificationJob job =
        new NewNotificationJob(
            request.title(),
            request.body(),
            writePayload(toPayload(request)),
            Boolean.TRUE.equals(request.allUsers())
                ? NotificationTarget.broadcast()
                : NotificationTarget.users(request.userIds()),
            request.scheduledTime(),
            userId,
            request.maxAttempts());
    final String jobId = queueService.addJob(job);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            new CreateNotificationJobResponse(
                jobId, request.scheduledTime(), NotificationJobStatus.PENDING.name()));
  }

  @GetMapping
  public ResponseEntity<NotificationJobListResponse> listJobs(
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "created_by", required = false) String createdBy,
      @RequestParam(name = "limit", defaultValue = "20") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    final int effectiveLimit = Math.min(Math.max(limit, 1), MAX_PAGE_SIZE);
    final int effectiveOffset = Math.max(offset, 0);
    final NotificationJobPage page =
        queueService.listJobs(
            new NotificationJobFilter(parseStatus(status), createdBy),
            effectiveLimit,
            effectiveOffset);
    final List<NotificationJobResponse> jobs = page.jobs().stream().map(this::toResponse).toList();
    return ResponseEntity.ok(
        new NotificationJobListResponse(
            jobs,
            PaginationResponse.of(page.total(), effectiveLimit, effectiveOffset, jobs.size())));
  }

  @GetMapping("/{jobId}")
  public ResponseEntity<NotificationJobResponse> getJob(@PathVariable("jobId") String jobId) {
    return ResponseEntity.ok(toResponse(queueService.getJob(jobId)));
  }

  @DeleteMapping("/{jobId}")
  public ResponseEntity<CancelNotificationJobResponse> cancelJob(
      @PathVariable("jobId") String jobId) {
    return ResponseEntity.ok(new CancelNotificationJobResponse(jobId, queueService.cancelJob(jobId)));
  }

  @PostMapping("/cancel")
  public ResponseEntity<CancelNotificationJobsResponse> cancelJobs(
      @Valid @RequestBody CancelNotificationJobsRequest request) {
    final List<CancelNotificationJobResponse> results =
        request.jobIds().stream()
            .map(jobId -> new CancelNotificationJobResponse(jobId, queueService.cancelJob(jobId)))
            .toList();
    final int cancelledCount =
        (int) results.stream().filter(CancelNotificationJobResponse::cancelled).count();
    return ResponseEntity.ok(new CancelNotificationJobsResponse(results, cancelledCount));
  }

  @GetMapping("/stats")
  public ResponseEntity<NotificationJobStatsResponse> stats() {
    return ResponseEntity.ok(NotificationJobStatsResponse.from(queueService.getStats()));
  }

  @PostMapping("/cleanup")
  public ResponseEntity<CleanupResponse> cleanup(
      @RequestParam(name = "retention_days") int retentionDays) {
    return ResponseEntity.ok(new CleanupResponse(queueService.cleanup(retentionDays), retentionDays));
  }

  @GetMapping("/processor")
  public ResponseEntity<ProcessorStatusResponse> processorStatus() {
    return ResponseEntity.ok(ProcessorStatusResponse.from(queueService.getProcessorStatus()));
  }

  @PostMapping("/processor/start")
  public ResponseEntity<ProcessorCommandResponse> startProcessor() {
    final boolean changed = processorController.start();
    return ResponseEntity.ok(
        new ProcessorCommandResponse(
            changed, ProcessorStatusResponse.from(processorController.status())));
  }

  @PostMapping("/processor/stop")
  public ResponseEntity<ProcessorCommandResponse> stopProcessor() {
    final boolean changed = processorController.stop();
    return ResponseEntity.ok(
        new ProcessorCommandResponse(
            changed, ProcessorStatusResponse.from(processorController.status())));
  }

  private NotificationJobStatus parseStatus(String status) {
    try {
      return NotificationJobStatus.parse(status);
    } catch (IllegalArgumentException ex) {
      throw new InvalidNotificationJobRequestException(ex.getMessage());
    }
  }

  private NotificationPayload toPayload(CreateNotificationJobRequest request) {
    final List<NotificationAction> actions =
        request.actions() == null
            ? null
            : request.actions().stream().map(this::toAction).toList();
    return new NotificationPayload(
        request.icon(),
        request.badge(),
        request.image(),
        request.data(),
        actions,
        request.tag(),
        request.requireInteraction(),
        request.silent(),
        request.vibrate());
  }

  private NotificationAction toAction(NotificationActionRequest action) {
    return new NotificationAction(action.action(), action.title(), action.icon());
  }

  private String writePayload(NotificationPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload serialization failure", ex);
    }
  }

  private NotificationJobResponse toResponse(NotificationJob job) {
    try {
      final JsonNode payload = objectMapper.readTree(job.payloadJson());
      return NotificationJobResponse.from(job, payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload parse failure", ex);
    }
  }
}
