package com.stakeledger.web;

import org.springframework.http.HttpStatus;

public class LedgerStateException extends LedgerException {

    public LedgerStateException(HttpStatus status, String code, String message) {
        super(status, code, message);
    }

    public static LedgerStateException poolNotFound(long poolId) {
        return new LedgerStateException(
                HttpStatus.NOT_FOUND,
                "pool_not_found",
                "Staking pool not found: " + poolId
        );
    }

    public static LedgerStateException poolInactive(long poolId) {
        return new LedgerStateException(
                HttpStatus.CONFLICT,
                "pool_inactive",
                "Staking pool is not active: " + poolId
        );
    }

    public static LedgerStateException positionInactive(String detail) {
        return new LedgerStateException(HttpStatus.CONFLICT, "position_inactive", detail);
    }

    public static LedgerStateException insufficientStake(String detail) {
        return new LedgerStateException(HttpStatus.CONFLICT, "insufficient_stake", detail);
    }

    public static LedgerStateException lockupNotElapsed(String detail) {
        return new LedgerStateException(HttpStatus.CONFLICT, "lockup_not_elapsed", detail);
    }

    public static LedgerStateException transferFailed(String detail) {
        return new LedgerStateException(HttpStatus.CONFLICT, "transfer_failed", detail);
    }

    public static LedgerStateException reentrantCall(long poolId) {
        return new LedgerStateException(
                HttpStatus.CONFLICT,
                "reentrant_call",
                "Pool " + poolId + " is already executing a mutation on this thread"
        );
    }
}
