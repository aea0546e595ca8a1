package com.example.notificationjobs.api;

import com.example.notificationjobs.service.InvalidNotificationJobRequestException;
import com.example.notificationjobs.service.NotificationJobNotFoundException;
import com.example.notificationjobs.service.NotificationJobQuotaExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidNotificationJobRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(
      InvalidNotificationJobRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingRequestHeaderException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_MALFORMED_REQUEST", "malformed request"));
  }

  @ExceptionHandler(NotificationJobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(NotificationJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotificationJobQuotaExceededException.class)
  public ResponseEntity<ApiErrorResponse> handleQuotaExceeded(
      NotificationJobQuotaExceededException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_DAILY_LIMIT", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("notification job api request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("NOTIFICATION_JOB_INTERNAL_ERROR", ex.getMessage()));
  }
}
