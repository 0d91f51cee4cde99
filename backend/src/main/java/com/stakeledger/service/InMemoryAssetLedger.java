package com.stakeledger.service;

import com.stakeledger.config.StakeLedgerProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Service
@ConditionalOnProperty(
        prefix = "stakeledger.asset-ledger",
        name = "mode",
        havingValue = "in_memory",
        matchIfMissing = true
)
public class InMemoryAssetLedger implements AssetLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetLedger.class);

    private final Map<String, Map<String, BigInteger>> balancesByAsset = new ConcurrentHashMap<>();
    private final StakeLedgerProperties properties;

    public InMemoryAssetLedger(StakeLedgerProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void seedBalances() {
        for (StakeLedgerProperties.SeedBalance seed : properties.getAssetLedger().getSeedBalances()) {
            mint(seed.getAsset(), seed.getAccount(), seed.getAmount());
        }
        if (!properties.getAssetLedger().getSeedBalances().isEmpty()) {
            log.info("Seeded {} in-memory asset balances", properties.getAssetLedger().getSeedBalances().size());
        }
    }

    @Override
    public synchronized TransferResult transfer(String asset, String from, String to, BigInteger amount) {
        Objects.requireNonNull(asset, "asset is required");
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        if (amount == null || amount.signum() <= 0) {
            return TransferResult.failed("Transfer amount must be positive");
        }

        Map<String, BigInteger> balances = balancesFor(asset);
        BigInteger fromBalance = balances.getOrDefault(from, BigInteger.ZERO);
        if (fromBalance.compareTo(amount) < 0) {
            return TransferResult.failed(
                    "Insufficient " + asset + " balance for " + from + ": " + fromBalance + " < " + amount
            );
        }

        balances.put(from, fromBalance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        log.debug("Transferred {} {} from {} to {}", amount, asset, from, to);
        return TransferResult.ok();
    }

    @Override
    public BigInteger balanceOf(String asset, String account) {
        return balancesFor(asset).getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * Credits an account out of thin air. Used to fund development and test balances.
     */
    public synchronized void mint(String asset, String account, BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Mint amount must not be negative");
        }
        balancesFor(asset).merge(Objects.requireNonNull(account, "account is required"), amount, BigInteger::add);
    }

    private Map<String, BigInteger> balancesFor(String asset) {
        return balancesByAsset.computeIfAbsent(
                Objects.requireNonNull(asset, "asset is required"),
                ignored -> new ConcurrentHashMap<>()
        );
    }
}
