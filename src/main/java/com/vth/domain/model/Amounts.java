package com.vth.domain.model;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Arithmetic settings shared by conversions and ledger postings
 */
public final class Amounts {

    public static final MathContext MATH_CONTEXT = MathContext.DECIMAL64;

    // Ledger precision: satoshi-level for crypto, more than enough for fiat
    public static final int SCALE = 8;

    private Amounts() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
