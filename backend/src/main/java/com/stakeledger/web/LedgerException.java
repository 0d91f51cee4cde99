package com.stakeledger.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for every rejected ledger operation. A rejected operation leaves
 * pool and position state untouched.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected LedgerException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }
}
