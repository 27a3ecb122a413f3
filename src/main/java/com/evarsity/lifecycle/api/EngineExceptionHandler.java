package com.evarsity.lifecycle.api;

import com.evarsity.lifecycle.error.LifecycleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class EngineExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(EngineExceptionHandler.class);

    @ExceptionHandler(LifecycleException.class)
    public ResponseEntity<ErrorBody> handleLifecycle(LifecycleException ex) {
        return switch (ex.getKind()) {
            case NOT_ENROLLED, COURSE_NOT_FOUND -> reject(HttpStatus.NOT_FOUND, ex);
            case ALREADY_ENROLLED -> reject(HttpStatus.CONFLICT, ex);
            case NO_POLICY_DEFINED -> reject(HttpStatus.UNPROCESSABLE_ENTITY, ex);
            case INVALID_REQUEST -> reject(HttpStatus.BAD_REQUEST, ex);
            case INVARIANT_VIOLATION -> {
                log.error("Invariant violation, operation aborted", ex);
                yield ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(new ErrorBody("internal_error", "The operation failed and no changes were made", false));
            }
        };
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorBody> handleLockConflict(PessimisticLockingFailureException ex) {
        log.warn("Lock conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorBody("lock_conflict", "Another operation on this enrollment is in progress, retry", true));
    }

    private ResponseEntity<ErrorBody> reject(HttpStatus status, LifecycleException ex) {
        log.warn("Rejected: {}", ex.getMessage());
        return ResponseEntity.status(status).body(new ErrorBody(ex.getKind().name().toLowerCase(), ex.getMessage(), false));
    }

    public record ErrorBody(String error, String message, boolean retryable) {}
}
