package com.vth.application.service;

import java.time.Duration;

/**
 * Staleness rules applied to trades and valuations.
 * When {@code rejectStaleRates} is set, trades against a table older than {@code maxRateAge} are refused.
 */
public record TradePolicy(boolean rejectStaleRates, Duration maxRateAge) {

    public TradePolicy {
        if (maxRateAge == null || maxRateAge.isNegative()) {
            throw new IllegalArgumentException("maxRateAge must be a non-negative duration");
        }
    }

    public static TradePolicy allowStale(Duration maxRateAge) {
        return new TradePolicy(false, maxRateAge);
    }

    public static TradePolicy rejectOlderThan(Duration maxRateAge) {
        return new TradePolicy(true, maxRateAge);
    }
}
