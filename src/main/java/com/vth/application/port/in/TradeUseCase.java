package com.vth.application.port.in;

import com.vth.domain.model.TradeReceipt;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for trading against the cached rates
 */
public interface TradeUseCase {

    /**
     * Buy {@code amount} units of {@code currency}, paying in the portfolio's base currency
     */
    Future<TradeReceipt> buy(String userId, String currency, BigDecimal amount);

    /**
     * Sell {@code amount} units of {@code currency} for the portfolio's base currency
     */
    Future<TradeReceipt> sell(String userId, String currency, BigDecimal amount);

    /**
     * Completed trades of a user, oldest first
     */
    Future<List<TradeReceipt>> tradeHistory(String userId);
}
