package com.scholary.djset.api;

import com.scholary.djset.download.DownloadException;
import com.scholary.djset.job.InvalidJobStateException;
import com.scholary.djset.job.JobNotFoundException;
import com.scholary.djset.service.TrackNotAvailableException;
import com.scholary.djset.trackid.TrackIdException;
import com.scholary.djset.tracklist.TracklistException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to HTTP responses with an {@code {"error": ...}} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({JobNotFoundException.class, TrackNotAvailableException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler({
    InvalidJobStateException.class,
    TracklistException.class,
    DownloadException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(RuntimeException e) {
    LOGGER.debug("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    Map<String, String> details = new LinkedHashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      details.put(error.getField(), error.getDefaultMessage());
    }
    return ResponseEntity.badRequest().body(new ErrorResponse("Validation failed", details));
  }

  @ExceptionHandler(TrackIdException.class)
  public ResponseEntity<ErrorResponse> handleUpstream(TrackIdException e) {
    LOGGER.warn("TrackID lookup failed: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(e.getMessage()));
  }

  @ExceptionHandler(RejectedExecutionException.class)
  public ResponseEntity<ErrorResponse> handleBusy(RejectedExecutionException e) {
    LOGGER.warn("Job rejected, executor is saturated");
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse("Too many jobs in progress, try again later"));
  }
}
