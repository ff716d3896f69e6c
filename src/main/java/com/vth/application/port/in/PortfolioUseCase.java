package com.vth.application.port.in;

import com.vth.domain.model.Portfolio;
import com.vth.domain.model.PortfolioValuation;
import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Input port for portfolio lifecycle and valuation
 */
public interface PortfolioUseCase {

    /**
     * Create the portfolio of a newly registered user. Returns the existing one if present.
     * @param seed Optional initial balance in the base currency
     */
    Future<Portfolio> openPortfolio(String userId, BigDecimal seed);

    /**
     * Value of every non-zero balance converted to {@code baseCurrency}, or to the
     * portfolio's own base currency when null
     */
    Future<PortfolioValuation> getPortfolioValue(String userId, String baseCurrency);

    /**
     * Credit a currency to the user's wallet
     */
    Future<Portfolio> deposit(String userId, String currency, BigDecimal amount);
}
