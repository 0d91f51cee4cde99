package com.stakeledger.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LedgerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LedgerExceptionHandler.class);

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<LedgerErrorResponse> handle(LedgerException ex) {
        log.debug("Ledger operation rejected: code={}, message={}", ex.getCode(), ex.getMessage());
        return ResponseEntity
                .status(ex.getStatus())
                .body(new LedgerErrorResponse(ex.getCode(), ex.getMessage()));
    }

    public record LedgerErrorResponse(
            String code,
            String message
    ) {
    }
}
