package com.vth.adapter.in.web.portfolio;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of POST /api/portfolios/{userId}; the seed is optional
 */
public record OpenPortfolioRequest(BigDecimal seed) {
    @JsonCreator
    public OpenPortfolioRequest(@JsonProperty("seed") BigDecimal seed) {
        this.seed = seed;
    }
}
