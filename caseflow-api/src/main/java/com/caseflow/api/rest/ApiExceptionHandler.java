package com.caseflow.api.rest;

import com.caseflow.core.exception.DuplicateInstanceException;
import com.caseflow.core.exception.InvalidStateTransitionException;
import com.caseflow.core.exception.NotFoundException;
import com.caseflow.core.exception.OptimisticLockException;
import com.caseflow.core.exception.OrchestratorException;
import com.caseflow.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps orchestrator errors to HTTP responses of the form {errorCode, message}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> handleOrchestrator(OrchestratorException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage(), Map.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(BAD_REQUEST, e.getMessage(), Map.of()));
    }

    static HttpStatus statusFor(OrchestratorException e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof InvalidStateTransitionException
                || e instanceof DuplicateInstanceException
                || e instanceof OptimisticLockException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof WorkflowValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    public record ErrorResponse(String errorCode, String message, Map<String, Object> details) {}
}
