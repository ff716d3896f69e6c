package com.vth.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable audit record of one completed trade
 */
@Value
@Builder
public class TradeReceipt {
    String id;
    String userId;
    Currency currency;              // traded currency
    TradeDirection direction;
    BigDecimal amount;              // units of the traded currency
    BigDecimal rateUsed;            // price of one unit in the base currency
    Currency baseCurrency;
    BigDecimal baseCurrencyDelta;   // negative for BUY, positive for SELL
    long rateTableVersion;
    Instant timestamp;

    public boolean isBuy() {
        return TradeDirection.BUY.equals(direction);
    }

    public boolean isSell() {
        return TradeDirection.SELL.equals(direction);
    }
}
