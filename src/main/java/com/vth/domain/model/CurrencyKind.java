package com.vth.domain.model;

/**
 * Kind of a supported currency
 */
public enum CurrencyKind {
    FIAT("FIAT"),
    CRYPTO("CRYPTO");

    private final String value;

    CurrencyKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
