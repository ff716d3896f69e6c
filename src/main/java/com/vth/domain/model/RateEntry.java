package com.vth.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Price of one unit of a currency expressed in the base currency
 */
@Value
public class RateEntry {
    Currency currency;
    BigDecimal priceInBase;     // always > 0
    Instant fetchedAt;
    RateProvider source;

    public RateEntry(Currency currency, BigDecimal priceInBase, Instant fetchedAt, RateProvider source) {
        this.currency = Objects.requireNonNull(currency, "currency");
        this.priceInBase = Objects.requireNonNull(priceInBase, "priceInBase");
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
        this.source = Objects.requireNonNull(source, "source");
        if (priceInBase.signum() <= 0) {
            throw new IllegalArgumentException("Price of " + currency + " must be positive, got " + priceInBase);
        }
    }

    public static RateEntry base(Currency baseCurrency, Instant at) {
        return new RateEntry(baseCurrency, BigDecimal.ONE, at, RateProvider.BASE);
    }

    public boolean isBase() {
        return source == RateProvider.BASE;
    }
}
