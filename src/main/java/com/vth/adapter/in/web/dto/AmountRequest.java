package com.vth.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of deposit, buy and sell requests
 */
public record AmountRequest(
        String currency,
        BigDecimal amount
) {
    @JsonCreator
    public AmountRequest(
            @JsonProperty("currency") String currency,
            @JsonProperty("amount") BigDecimal amount
    ) {
        this.currency = currency;
        this.amount = amount;
    }
}
