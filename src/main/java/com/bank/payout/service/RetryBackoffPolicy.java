package com.bank.payout.service;

import com.bank.payout.config.AutomationConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Exponential backoff with equal jitter: half of the capped delay is fixed, the other half random.
 */
@Component
public class RetryBackoffPolicy {

    private final AutomationConfig config;
    private final Random random;

    @Autowired
    public RetryBackoffPolicy(AutomationConfig config) {
        this(config, new Random());
    }

    RetryBackoffPolicy(AutomationConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * @param attempt 1-based number of the attempt that just failed
     */
    public long delayMs(int attempt) {
        AutomationConfig.Retry retry = config.getRetry();
        double exponential = retry.getBaseDelayMs() * Math.pow(retry.getMultiplier(), Math.max(0, attempt - 1));
        long capped = (long) Math.min(retry.getMaxDelayMs(), exponential);
        long half = capped / 2;
        return half + (long) (random.nextDouble() * (capped - half));
    }

    public long treasuryHaltHoldMs() {
        return config.getRetry().getTreasuryHaltHoldMs();
    }
}
