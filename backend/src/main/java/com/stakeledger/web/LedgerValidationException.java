package com.stakeledger.web;

import org.springframework.http.HttpStatus;

public class LedgerValidationException extends LedgerException {

    public LedgerValidationException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
    }

    public static LedgerValidationException invalidAmount(String detail) {
        return new LedgerValidationException("invalid_amount", detail);
    }

    public static LedgerValidationException belowMinimumStake(String detail) {
        return new LedgerValidationException("below_minimum_stake", detail);
    }

    public static LedgerValidationException invalidPoolParameters(String detail) {
        return new LedgerValidationException("invalid_pool_parameters", detail);
    }

    public static LedgerValidationException idempotencyKeyReused(String detail) {
        return new LedgerValidationException("idempotency_key_reused", detail);
    }
}
