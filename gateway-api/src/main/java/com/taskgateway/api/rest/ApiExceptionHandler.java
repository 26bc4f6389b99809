package com.taskgateway.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.taskgateway.client.credential.SharedStoreUnavailableException;
import com.taskgateway.core.exception.GatewayException;
import com.taskgateway.core.exception.InvalidStateTransitionException;
import com.taskgateway.core.exception.LeaseLostException;
import com.taskgateway.core.exception.NotFoundException;
import com.taskgateway.core.exception.StoreUnavailableException;
import com.taskgateway.core.exception.TaskValidationException;
import com.taskgateway.core.model.ErrorClass;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

/**
 * Maps gateway exceptions onto the error body every endpoint returns.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(TaskValidationException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), e.getViolations(), request);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorClass.VALIDATION.code(), e.getMessage(), null, request);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler({InvalidStateTransitionException.class, LeaseLostException.class})
    public ResponseEntity<ErrorResponse> handleConflict(GatewayException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(StoreUnavailableException e, HttpServletRequest request) {
        log.error("Store unavailable while serving {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler(SharedStoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSharedStoreUnavailable(
            SharedStoreUnavailableException e, HttpServletRequest request) {
        log.error("Shared credential store unavailable while serving {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, StoreUnavailableException.ERROR_CODE, e.getMessage(), null, request);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGateway(GatewayException e, HttpServletRequest request) {
        log.error("Request {} failed with {}", request.getRequestURI(), e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error serving {}", request.getRequestURI(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorClass.INTERNAL.code(), e.getMessage(), null, request);
    }

    // ========== Helper Methods ==========

    private static ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            String errorCode,
            String errorMessage,
            List<String> violations,
            HttpServletRequest request) {

        ErrorResponse body = new ErrorResponse(
            "error",
            errorCode,
            errorMessage,
            isRetryAllowed(status),
            violations != null && !violations.isEmpty() ? violations : null,
            Instant.now(),
            request.getRequestURI()
        );
        return ResponseEntity.status(status).body(body);
    }

    static boolean isRetryAllowed(HttpStatus status) {
        return status.is5xxServerError()
            || status == HttpStatus.REQUEST_TIMEOUT
            || status == HttpStatus.TOO_MANY_REQUESTS;
    }

    // ========== DTOs ==========

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        String status,
        String errorCode,
        String errorMessage,
        boolean retryAllowed,
        List<String> violations,
        Instant timestamp,
        String path
    ) {}
}
