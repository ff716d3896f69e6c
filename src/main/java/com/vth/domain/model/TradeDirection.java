package com.vth.domain.model;

/**
 * Direction of a trade, seen from the traded currency
 */
public enum TradeDirection {
    BUY("BUY"),
    SELL("SELL");

    private final String value;

    TradeDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static TradeDirection fromValue(String value) {
        for (TradeDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown trade direction: " + value);
    }

    public static boolean isValid(String value) {
        for (TradeDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
