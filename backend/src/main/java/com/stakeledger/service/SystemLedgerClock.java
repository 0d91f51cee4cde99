package com.stakeledger.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

@Component
public class SystemLedgerClock implements LedgerClock {

    private final Clock clock;
    private final AtomicLong lastObserved = new AtomicLong(Long.MIN_VALUE);

    public SystemLedgerClock() {
        this(Clock.systemUTC());
    }

    SystemLedgerClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        long current = clock.instant().getEpochSecond();
        // wall clock steps backwards are clamped to the last value handed out
        return lastObserved.accumulateAndGet(current, Math::max);
    }
}
