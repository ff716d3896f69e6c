package com.vth.adapter.in.web.portfolio;

import com.vth.domain.model.Portfolio;
import com.vth.domain.model.PortfolioValuation;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * DTOs for portfolio state and valuation
 */
public final class PortfolioResponse {

    private PortfolioResponse() {
    }

    public record Balances(
            String userId,
            String baseCurrency,
            Map<String, BigDecimal> balances,
            int tradeCount
    ) {}

    public record Valuation(
            String userId,
            String baseCurrency,
            BigDecimal total,
            List<Line> lines,
            long rateTableVersion,
            String ratesAsOf,
            boolean stale
    ) {}

    public record Line(
            String currency,
            BigDecimal balance,
            BigDecimal rateToBase,
            BigDecimal valueInBase
    ) {}

    public static Balances balances(Portfolio portfolio) {
        Portfolio.Snapshot snapshot = portfolio.snapshot();
        Map<String, BigDecimal> balances = new LinkedHashMap<>();
        snapshot.balances().forEach((currency, amount) -> balances.put(currency.getCode(), amount));
        return new Balances(snapshot.userId(), snapshot.baseCurrency().getCode(), balances, snapshot.trades().size());
    }

    public static Valuation valuation(PortfolioValuation valuation) {
        List<Line> lines = valuation.lines().stream()
                .map(line -> new Line(line.currency().getCode(), line.balance(), line.rateToBase(), line.valueInBase()))
                .collect(Collectors.toList());
        return new Valuation(
                valuation.userId(),
                valuation.baseCurrency().getCode(),
                valuation.total(),
                lines,
                valuation.rateTableVersion(),
                valuation.ratesAsOf().toString(),
                valuation.stale()
        );
    }
}
