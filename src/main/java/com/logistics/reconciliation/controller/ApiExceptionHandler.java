package com.logistics.reconciliation.controller;

import com.logistics.reconciliation.dto.ErrorResponse;
import com.logistics.reconciliation.exception.FatalTransferException;
import com.logistics.reconciliation.exception.OrderNotFoundException;
import com.logistics.reconciliation.exception.PayloadNotFoundException;
import com.logistics.reconciliation.exception.ReconciliationException;
import com.logistics.reconciliation.exception.RetryExhaustedException;
import com.logistics.reconciliation.exception.StoreUnavailableException;
import com.logistics.reconciliation.exception.TransferCancelledException;
import com.logistics.reconciliation.exception.TransferRunException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;

/**
 * Maps reconciliation failures to HTTP status codes.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({OrderNotFoundException.class, PayloadNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ReconciliationException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler({StoreUnavailableException.class, RetryExhaustedException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(ReconciliationException e) {
        log.error("Store unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e);
    }

    @ExceptionHandler(FatalTransferException.class)
    public ResponseEntity<ErrorResponse> handleFatal(FatalTransferException e) {
        log.error("Fatal failure: {}", e.getMessage(), e);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(TransferCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(TransferCancelledException e) {
        log.warn("Run cancelled: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(ReconciliationException.class)
    public ResponseEntity<ErrorResponse> handleOther(ReconciliationException e) {
        log.error("Reconciliation failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception e) {
        String resumeAfter = null;
        if (e instanceof TransferRunException runException && runException.getCursor() != null) {
            resumeAfter = runException.getCursor().lastKey();
        }
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(e.getMessage())
                .resumeAfter(resumeAfter)
                .timestamp(LocalDateTime.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
