package com.stakeledger.config;

import com.stakeledger.model.LockupTopUpPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Staking ledger runtime settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "stakeledger")
public class StakeLedgerProperties {

    private Access access = new Access();
    private Lockup lockup = new Lockup();
    private Guard guard = new Guard();
    private Idempotency idempotency = new Idempotency();
    private AssetLedger assetLedger = new AssetLedger();

    @Getter
    @Setter
    public static class Access {
        /**
         * Role name to the accounts granted that role.
         */
        private Map<String, List<String>> roles = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Lockup {
        private LockupTopUpPolicy topUpPolicy = LockupTopUpPolicy.KEEP_ORIGINAL;
    }

    @Getter
    @Setter
    public static class Guard {
        /**
         * Upper bound on waiting for another operation on the same pool.
         */
        private long lockTimeoutMs = 5_000L;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean enabled = true;
        private long ttlSeconds = 86_400L;
        private long purgeIntervalMs = 60_000L;
        private int maxKeyLength = 128;
    }

    @Getter
    @Setter
    public static class AssetLedger {
        /**
         * "in_memory" keeps balances in process. Other modes expect an external AssetLedger bean.
         */
        private String mode = "in_memory";

        /**
         * Balances minted into the in-memory ledger at startup.
         */
        private List<SeedBalance> seedBalances = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class SeedBalance {
        private String asset;
        private String account;
        private BigInteger amount = BigInteger.ZERO;
    }
}
