package com.modelguard.modelguard.common;

import com.modelguard.modelguard.alerting.AlertTargetNotFoundException;
import com.modelguard.modelguard.alerting.NotificationDeliveryException;
import com.modelguard.modelguard.drift.DriftReportNotFoundException;
import com.modelguard.modelguard.ledger.BatchNotFoundException;
import com.modelguard.modelguard.ledger.DuplicateBatchNameException;
import com.modelguard.modelguard.ledger.LoaderBusyException;
import com.modelguard.modelguard.ledger.PartialCommitException;
import com.modelguard.modelguard.ledger.StaleEntityVersionException;
import com.modelguard.modelguard.promotion.PromotionDecisionNotFoundException;
import com.modelguard.modelguard.registry.MetricUnavailableException;
import com.modelguard.modelguard.registry.ModelVersionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps domain failures to HTTP statuses with an {@link ApiError} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({
            BatchNotFoundException.class,
            DriftReportNotFoundException.class,
            PromotionDecisionNotFoundException.class,
            AlertTargetNotFoundException.class,
            ModelVersionNotFoundException.class
    })
    public ResponseEntity<ApiError> handleNotFound(ModelGuardException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request, ex.getErrorCode());
    }

    @ExceptionHandler({
            LoaderBusyException.class,
            DuplicateBatchNameException.class,
            StaleEntityVersionException.class
    })
    public ResponseEntity<ApiError> handleConflict(ModelGuardException ex, HttpServletRequest request) {
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, ex.getErrorCode());
    }

    @ExceptionHandler(SkippedRunException.class)
    public ResponseEntity<ApiError> handleSkipped(SkippedRunException ex, HttpServletRequest request) {
        log.info("Request skipped. path={}, reason={}, detail={}", request.getRequestURI(), ex.getErrorCode(),
                ex.getMessage());
        return build(HttpStatus.CONFLICT, "Skipped", ex.getMessage(), request, ex.getErrorCode());
    }

    @ExceptionHandler(MetricUnavailableException.class)
    public ResponseEntity<ApiError> handleMetricUnavailable(MetricUnavailableException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Metric Unavailable", ex.getMessage(), request,
                ex.getErrorCode());
    }

    @ExceptionHandler(TransientInfrastructureException.class)
    public ResponseEntity<ApiError> handleUnavailable(TransientInfrastructureException ex, HttpServletRequest request) {
        log.error("Upstream unavailable at {}: {}", request.getRequestURI(), ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), request,
                ex.getErrorCode());
    }

    @ExceptionHandler(NotificationDeliveryException.class)
    public ResponseEntity<ApiError> handleNotification(NotificationDeliveryException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_GATEWAY, "Notification Failed", ex.getMessage(), request, ex.getErrorCode());
    }

    @ExceptionHandler(PartialCommitException.class)
    public ResponseEntity<ApiError> handlePartialCommit(PartialCommitException ex, HttpServletRequest request) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Batch Failed", ex.getMessage(), request, ex.getErrorCode());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "INVALID_ARGUMENT");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request
    ) {
        String message = "Parameter '%s' should be of type %s".formatted(ex.getName(),
                ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", message, request, "INVALID_ARGUMENT");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex, HttpServletRequest request) {
        HttpStatusCode status = ex.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String error = resolved == null ? "Error" : resolved.getReasonPhrase();
        ApiError body = new ApiError(status.value(), error, null, ex.getReason(), request.getRequestURI(),
                System.currentTimeMillis());
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status,
            String error,
            String message,
            HttpServletRequest request,
            String code
    ) {
        ApiError body = new ApiError(status.value(), error, code, message, request.getRequestURI(),
                System.currentTimeMillis());
        return ResponseEntity.status(status).body(body);
    }
}
