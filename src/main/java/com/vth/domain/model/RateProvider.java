package com.vth.domain.model;

/**
 * Origin of a rate entry
 */
public enum RateProvider {
    EXCHANGE_RATE_API("ExchangeRate-API"),
    COINGECKO("CoinGecko"),
    BASE("base");   // synthesized entry of the base currency, never fetched

    private final String value;

    RateProvider(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RateProvider fromValue(String value) {
        for (RateProvider provider : values()) {
            if (provider.value.equalsIgnoreCase(value)) {
                return provider;
            }
        }
        throw new IllegalArgumentException("Unknown rate provider: " + value);
    }
}
