package com.stakeledger.service;

import java.math.BigInteger;

/**
 * Custody collaborator that holds balances and moves them between accounts.
 * A failed transfer must leave both balances unchanged.
 */
public interface AssetLedger {

    TransferResult transfer(String asset, String from, String to, BigInteger amount);

    BigInteger balanceOf(String asset, String account);
}
