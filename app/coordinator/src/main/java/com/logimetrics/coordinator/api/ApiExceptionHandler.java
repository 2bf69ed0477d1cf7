package com.logimetrics.coordinator.api;

import com.logimetrics.coordinator.cron.InvalidScheduleException;
import com.logimetrics.coordinator.domain.StoreUnavailableException;
import com.logimetrics.coordinator.job.DuplicateJobException;
import com.logimetrics.coordinator.job.UnknownJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UnknownJobException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownJob(UnknownJobException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("JOB_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateJobException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateJob(DuplicateJobException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("JOB_ALREADY_REGISTERED", ex.getMessage()));
  }

  @ExceptionHandler(InvalidScheduleException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSchedule(InvalidScheduleException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("INVALID_SCHEDULE", ex.getMessage()));
  }

  @ExceptionHandler({InvalidRequestException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<ApiErrorResponse> handleInvalidRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(StoreUnavailableException ex) {
    logger.warn("admin request failed store={}", ex.store(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("STORE_UNAVAILABLE", ex.store() + " is unavailable"));
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiErrorResponse> handleDataAccess(DataAccessException ex) {
    return handleStoreUnavailable(StoreUnavailableException.from(ex));
  }
}
