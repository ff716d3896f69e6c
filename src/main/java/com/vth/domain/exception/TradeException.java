package com.vth.domain.exception;

import com.vth.domain.model.Currency;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Rejection of a trade or a wallet posting. The message is meant for the end user.
 */
@Getter
public class TradeException extends ValutaTradeException {

    public enum Kind {
        INVALID_AMOUNT,
        INSUFFICIENT_FUNDS,
        UNKNOWN_CURRENCY,
        STALE_RATES,
        INVALID_PAIR
    }

    private final Kind kind;
    private final Currency currency;
    private final BigDecimal available;
    private final BigDecimal required;

    private TradeException(Kind kind, Currency currency, BigDecimal available, BigDecimal required, String message) {
        super(message);
        this.kind = kind;
        this.currency = currency;
        this.available = available;
        this.required = required;
    }

    private TradeException(Kind kind, Currency currency, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.currency = currency;
        this.available = null;
        this.required = null;
    }

    public static TradeException invalidAmount(BigDecimal amount) {
        return new TradeException(Kind.INVALID_AMOUNT, null, null, null,
                "Amount must be positive, got " + (amount == null ? "nothing" : amount.toPlainString()));
    }

    public static TradeException amountTooSmall(BigDecimal amount, Currency currency) {
        return new TradeException(Kind.INVALID_AMOUNT, currency, null, null,
                "Amount " + amount.toPlainString() + " " + currency + " is too small to trade");
    }

    public static TradeException insufficientFunds(Currency currency, BigDecimal available, BigDecimal required) {
        return new TradeException(Kind.INSUFFICIENT_FUNDS, currency, available, required,
                String.format("Insufficient funds: available %s %s, required %s %s",
                        available.toPlainString(), currency, required.toPlainString(), currency));
    }

    public static TradeException unknownCurrency(Currency currency, Throwable cause) {
        return new TradeException(Kind.UNKNOWN_CURRENCY, currency,
                "No rate available for " + currency + ", try refreshing the rates", cause);
    }

    public static TradeException staleRates(Instant asOf, Duration maxAge) {
        return new TradeException(Kind.STALE_RATES, null, null, null,
                "Rates as of " + asOf + " are older than " + maxAge + ", refresh the rates before trading");
    }

    public static TradeException invalidPair(Currency currency) {
        return new TradeException(Kind.INVALID_PAIR, currency, null, null,
                currency + " is the base currency and cannot be traded against itself");
    }
}
