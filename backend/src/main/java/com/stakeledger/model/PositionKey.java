package com.stakeledger.model;

import java.util.Objects;

public record PositionKey(long poolId, String account) {

    public PositionKey {
        Objects.requireNonNull(account, "account is required");
    }
}
