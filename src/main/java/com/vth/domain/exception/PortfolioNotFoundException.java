package com.vth.domain.exception;

import lombok.Getter;

/**
 * Raised when a user has no portfolio
 */
@Getter
public class PortfolioNotFoundException extends ValutaTradeException {

    private final String userId;

    public PortfolioNotFoundException(String userId) {
        super("No portfolio for user '" + userId + "'");
        this.userId = userId;
    }
}
