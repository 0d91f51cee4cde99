package com.stakeledger.service;

public record TransferResult(
        boolean success,
        String failureReason
) {

    public static TransferResult ok() {
        return new TransferResult(true, null);
    }

    public static TransferResult failed(String reason) {
        return new TransferResult(false, reason);
    }
}
