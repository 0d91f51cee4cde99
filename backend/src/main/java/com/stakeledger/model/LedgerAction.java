package com.stakeledger.model;

/**
 * Administrative actions and the role a caller must hold to perform them.
 */
public enum LedgerAction {
    CREATE_POOL(LedgerRoles.POOL_ADMIN),
    SET_REWARD_RATE(LedgerRoles.POOL_ADMIN),
    SET_POOL_STATUS(LedgerRoles.POOL_ADMIN);

    private final String requiredRole;

    LedgerAction(String requiredRole) {
        this.requiredRole = requiredRole;
    }

    public String requiredRole() {
        return requiredRole;
    }
}
