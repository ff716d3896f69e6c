package com.vth.adapter.in.web.trade;

import com.vth.domain.model.TradeReceipt;

import java.math.BigDecimal;

/**
 * DTO for a completed trade
 */
public record TradeReceiptResponse(
        String id,
        String userId,
        String currency,
        String direction,
        BigDecimal amount,
        BigDecimal rateUsed,
        String baseCurrency,
        BigDecimal baseCurrencyDelta,
        long rateTableVersion,
        String timestamp
) {
    public static TradeReceiptResponse from(TradeReceipt receipt) {
        return new TradeReceiptResponse(
                receipt.getId(),
                receipt.getUserId(),
                receipt.getCurrency().getCode(),
                receipt.getDirection().getValue(),
                receipt.getAmount(),
                receipt.getRateUsed(),
                receipt.getBaseCurrency().getCode(),
                receipt.getBaseCurrencyDelta(),
                receipt.getRateTableVersion(),
                receipt.getTimestamp().toString()
        );
    }
}
