package com.vth.adapter.in.web.rates;

import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateTable;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * DTO for a published rate table
 */
public record RateTableResponse(
        long version,
        String baseCurrency,
        String asOf,
        String createdAt,
        boolean stale,
        List<Rate> rates
) {
    public record Rate(
            String currency,
            BigDecimal priceInBase,
            String fetchedAt,
            String source
    ) {}

    public static RateTableResponse from(RateTable table, boolean stale) {
        List<Rate> rates = table.getEntries().values().stream()
                .map(RateTableResponse::toRate)
                .collect(Collectors.toList());
        return new RateTableResponse(
                table.getVersion(),
                table.getBaseCurrency().getCode(),
                table.getAsOf().toString(),
                table.getCreatedAt().toString(),
                stale,
                rates
        );
    }

    private static Rate toRate(RateEntry entry) {
        return new Rate(
                entry.getCurrency().getCode(),
                entry.getPriceInBase(),
                entry.getFetchedAt().toString(),
                entry.getSource().getValue()
        );
    }
}
