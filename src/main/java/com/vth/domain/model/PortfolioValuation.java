package com.vth.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Value of a portfolio in one base currency, computed from a single rate table
 */
public record PortfolioValuation(
        String userId,
        Currency baseCurrency,
        BigDecimal total,
        List<Line> lines,
        long rateTableVersion,
        Instant ratesAsOf,
        boolean stale
) {

    public record Line(
            Currency currency,
            BigDecimal balance,
            BigDecimal rateToBase,
            BigDecimal valueInBase
    ) {}
}
