package com.vaultstake.web;

import com.vaultstake.custody.CustodyTransferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class StakingExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(StakingExceptionHandler.class);

    @ExceptionHandler(StakingException.class)
    public ResponseEntity<StakingErrorResponse> handle(StakingException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new StakingErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(CustodyTransferException.class)
    public ResponseEntity<StakingErrorResponse> handle(CustodyTransferException ex) {
        log.warn("Custody transfer failed: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new StakingErrorResponse("CUSTODY_TRANSFER_FAILED", ex.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<StakingErrorResponse> handle(MissingRequestHeaderException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new StakingErrorResponse("MISSING_CALLER", ex.getMessage()));
    }

    /**
     * Rejected admin and custody request bodies. Only the first message per field is kept.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<InvalidRequestResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(error -> fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage()));

        String detail = "Invalid " + ex.getParameter().getParameterType().getSimpleName();
        if (!fieldErrors.isEmpty()) {
            detail += ": " + String.join("; ", fieldErrors.values());
        }
        log.debug("Rejected request body: {}", fieldErrors);
        return ResponseEntity.badRequest()
                .body(new InvalidRequestResponse("INVALID_REQUEST", detail, fieldErrors));
    }

    public record StakingErrorResponse(
            String code,
            String message
    ) {
    }

    public record InvalidRequestResponse(
            String code,
            String detail,
            Map<String, String> fieldErrors
    ) {
    }
}
