package com.stakeledger.model;

/**
 * How an additional stake into an already active position treats the lockup clock.
 */
public enum LockupTopUpPolicy {
    /**
     * The lockup clock starts when the position enters ACTIVE and top ups leave it alone.
     */
    KEEP_ORIGINAL,
    /**
     * Every stake restarts the lockup clock for the whole position.
     */
    RESTART
}
