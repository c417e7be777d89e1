package net.scanward.app.web;

import net.scanward.app.web.dto.ErrorResponse;
import net.scanward.core.error.BackpressureException;
import net.scanward.core.error.DispatchException;
import net.scanward.core.error.IdentifierAllocationException;
import net.scanward.core.error.InvalidStateException;
import net.scanward.core.error.NotFoundException;
import net.scanward.core.error.PersistenceException;
import net.scanward.core.error.ScanwardException;
import net.scanward.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the scan error taxonomy onto HTTP statuses with a uniform JSON body
 * {@code {"error": code, "message": detail, "retryable": bool}}.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> invalid(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("malformed_body", "Request body is not valid JSON for this route", false));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> invalidState(InvalidStateException e) {
        return body(HttpStatus.CONFLICT, "invalid_state", e);
    }

    @ExceptionHandler(BackpressureException.class)
    public ResponseEntity<ErrorResponse> overloaded(BackpressureException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header("Retry-After", "5")
                .body(new ErrorResponse("overloaded", e.getMessage(), e.retryable()));
    }

    @ExceptionHandler(DispatchException.class)
    public ResponseEntity<ErrorResponse> dispatch(DispatchException e) {
        log.error("Dispatch failed for scan {}", e.getScanId(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "dispatch_failed", e);
    }

    @ExceptionHandler(IdentifierAllocationException.class)
    public ResponseEntity<ErrorResponse> idAllocation(IdentifierAllocationException e) {
        log.error("Scan id allocation failed", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "id_allocation_failed", e);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> persistence(PersistenceException e) {
        log.error("Store operation failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "store_failed", e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        // Spring MVC의 405/415 등은 자기 상태코드 그대로
        if (e instanceof org.springframework.web.ErrorResponse mvc) {
            return ResponseEntity.status(mvc.getStatusCode())
                    .body(new ErrorResponse("request_rejected", mvc.getBody().getDetail(), false));
        }
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal_error", "Internal Server Error", false));
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String code, ScanwardException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage(), e.retryable()));
    }
}
