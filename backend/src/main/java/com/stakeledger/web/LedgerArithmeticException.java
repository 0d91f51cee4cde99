package com.stakeledger.web;

import org.springframework.http.HttpStatus;

/**
 * Raised instead of wrapping when accrual or balance math leaves the unsigned 256-bit range.
 */
public class LedgerArithmeticException extends LedgerException {

    public LedgerArithmeticException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "arithmetic_overflow", message);
    }
}
