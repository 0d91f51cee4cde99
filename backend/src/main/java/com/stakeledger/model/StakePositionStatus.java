package com.stakeledger.model;

public enum StakePositionStatus {
    UNSTAKED,
    ACTIVE,
    FULLY_WITHDRAWN
}
