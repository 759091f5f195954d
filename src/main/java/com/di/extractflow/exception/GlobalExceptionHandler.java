package com.di.extractflow.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions escaping the REST layer to a structured error body tagged with its {@link ErrorCategory}.
 *
 * <ul>
 *   <li>invariant violations → 409</li>
 *   <li>object storage and transfer failures → 502</li>
 *   <li>step failures → 500 with the failed partitions</li>
 *   <li>validation errors → 400</li>
 * </ul>
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(InvariantViolationException e) {
        return respond("INVARIANT_VIOLATION", e, HttpStatus.CONFLICT);
    }

    @ExceptionHandler({ObjectStorageException.class, ParallelPhaseException.class})
    public ResponseEntity<ErrorResponse> handleStorage(ExtractFlowException e) {
        return respond("STORAGE_EXCEPTION", e, HttpStatus.BAD_GATEWAY);
    }

    @ExceptionHandler(StepExecutionException.class)
    public ResponseEntity<ErrorResponse> handleStepFailure(StepExecutionException e) {
        ResponseEntity<ErrorResponse> response = respond("STEP_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse body = response.getBody();
        if (body != null) {
            body.addDetail("step", e.getStepName());
            body.addDetail("failedPartitions", e.getFailedPartitions());
        }
        return response;
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class})
    public ResponseEntity<ErrorResponse> handleValidation(Exception e) {
        return respond("VALIDATION_EXCEPTION", e, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception e) {
        return respond("UNHANDLED_EXCEPTION", e, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> respond(String eventType, Throwable e, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[{}] {} [{}] runId={}", eventType, e.getClass().getSimpleName(), category.getName(),
                MDC.get("runId"), e);
        return ResponseEntity.status(status).body(buildErrorResponse(category, e, status));
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
