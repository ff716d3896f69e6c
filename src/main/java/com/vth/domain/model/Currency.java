package com.vth.domain.model;

import com.vth.domain.exception.ConversionException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of currencies the hub accepts.
 * Fiat currencies carry their issuing region, crypto currencies their consensus algorithm
 * and the coin id used by CoinGecko.
 */
public enum Currency {
    USD("US Dollar", CurrencyKind.FIAT, "United States", null),
    EUR("Euro", CurrencyKind.FIAT, "Eurozone", null),
    GBP("British Pound", CurrencyKind.FIAT, "United Kingdom", null),
    RUB("Russian Ruble", CurrencyKind.FIAT, "Russia", null),
    CNY("Chinese Yuan", CurrencyKind.FIAT, "China", null),
    JPY("Japanese Yen", CurrencyKind.FIAT, "Japan", null),
    AED("UAE Dirham", CurrencyKind.FIAT, "United Arab Emirates", null),
    BTC("Bitcoin", CurrencyKind.CRYPTO, "SHA-256", "bitcoin"),
    ETH("Ethereum", CurrencyKind.CRYPTO, "Ethash", "ethereum"),
    SOL("Solana", CurrencyKind.CRYPTO, "Proof of History", "solana");

    private final String displayName;
    private final CurrencyKind kind;
    private final String origin;        // issuing region (fiat) or algorithm (crypto)
    private final String coinGeckoId;

    Currency(String displayName, CurrencyKind kind, String origin, String coinGeckoId) {
        this.displayName = displayName;
        this.kind = kind;
        this.origin = origin;
        this.coinGeckoId = coinGeckoId;
    }

    public String getCode() {
        return name();
    }

    public String getDisplayName() {
        return displayName;
    }

    public CurrencyKind getKind() {
        return kind;
    }

    public String getCoinGeckoId() {
        return coinGeckoId;
    }

    public boolean isFiat() {
        return kind == CurrencyKind.FIAT;
    }

    public boolean isCrypto() {
        return kind == CurrencyKind.CRYPTO;
    }

    /**
     * One-line description for UIs and logs
     */
    public String getDisplayInfo() {
        if (isFiat()) {
            return String.format("[FIAT] %s - %s (Issuing: %s)", name(), displayName, origin);
        }
        return String.format("[CRYPTO] %s - %s (Algo: %s)", name(), displayName, origin);
    }

    public static Set<Currency> ofKind(CurrencyKind kind) {
        EnumSet<Currency> result = EnumSet.noneOf(Currency.class);
        for (Currency currency : values()) {
            if (currency.kind == kind) {
                result.add(currency);
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public static Currency fromValue(String value) {
        if (value != null) {
            String code = value.trim();
            for (Currency currency : values()) {
                if (currency.name().equalsIgnoreCase(code)) {
                    return currency;
                }
            }
        }
        throw ConversionException.unknownCurrency(value);
    }

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        String code = value.trim();
        for (Currency currency : values()) {
            if (currency.name().equalsIgnoreCase(code)) {
                return true;
            }
        }
        return false;
    }
}
