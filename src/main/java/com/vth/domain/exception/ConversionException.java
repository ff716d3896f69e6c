package com.vth.domain.exception;

import lombok.Getter;

/**
 * Raised when an amount cannot be converted through the current rate table
 */
@Getter
public class ConversionException extends ValutaTradeException {

    public enum Kind {
        UNKNOWN_CURRENCY
    }

    private final Kind kind;
    private final String currencyCode;

    private ConversionException(Kind kind, String currencyCode, String message) {
        super(message);
        this.kind = kind;
        this.currencyCode = currencyCode;
    }

    public static ConversionException unknownCurrency(String currencyCode) {
        return new ConversionException(Kind.UNKNOWN_CURRENCY, currencyCode,
                "Unknown currency '" + currencyCode + "'");
    }

    public static ConversionException noRate(String currencyCode) {
        return new ConversionException(Kind.UNKNOWN_CURRENCY, currencyCode,
                "No rate available for currency '" + currencyCode + "'");
    }
}
