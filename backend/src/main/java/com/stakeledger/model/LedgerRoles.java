package com.stakeledger.model;

public final class LedgerRoles {

    public static final String POOL_ADMIN = "POOL_ADMIN";

    private LedgerRoles() {
    }
}
