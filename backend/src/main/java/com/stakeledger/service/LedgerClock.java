package com.stakeledger.service;

/**
 * Time source for accrual. Implementations must never move backwards.
 */
public interface LedgerClock {

    /**
     * @return current time in epoch seconds
     */
    long now();
}
