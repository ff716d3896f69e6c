package com.vth.application.service;

import com.vth.application.port.in.TradeUseCase;
import com.vth.domain.exception.ConversionException;
import com.vth.domain.exception.TradeException;
import com.vth.domain.model.Amounts;
import com.vth.domain.model.Currency;
import com.vth.domain.model.Portfolio;
import com.vth.domain.model.RateTable;
import com.vth.domain.model.TradeDirection;
import com.vth.domain.model.TradeReceipt;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Executes buy and sell orders against the cached rates.
 * <p>
 * Holds no state of its own. Each trade reads one rate table when it starts and uses it for every
 * step, so a refresh completing mid-trade cannot change the rate partway through. Both wallet
 * legs are posted in one critical section of the user's portfolio.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeEngine implements TradeUseCase {

    private final RateCache rateCache;
    private final PortfolioService portfolioService;
    private final TradePolicy policy;
    private final Clock clock;

    @Override
    public Future<TradeReceipt> buy(String userId, String currency, BigDecimal amount) {
        return trade(userId, currency, amount, TradeDirection.BUY);
    }

    @Override
    public Future<TradeReceipt> sell(String userId, String currency, BigDecimal amount) {
        return trade(userId, currency, amount, TradeDirection.SELL);
    }

    @Override
    public Future<List<TradeReceipt>> tradeHistory(String userId) {
        return portfolioService.findPortfolio(userId).map(Portfolio::trades);
    }

    private Future<TradeReceipt> trade(String userId, String currency, BigDecimal amount, TradeDirection direction) {
        if (!Amounts.isPositive(amount)) {
            return Future.failedFuture(TradeException.invalidAmount(amount));
        }
        Currency traded;
        try {
            traded = Currency.fromValue(currency);
        } catch (ConversionException e) {
            return Future.failedFuture(e);
        }

        return portfolioService.findPortfolio(userId)
                .compose(portfolio -> {
                    TradeReceipt receipt = direction == TradeDirection.BUY
                            ? executeBuy(portfolio, traded, amount)
                            : executeSell(portfolio, traded, amount);
                    return portfolioService.persist(portfolio).map(receipt);
                })
                .onFailure(error -> log.warn("{} {} {} for user {} rejected: {}",
                        direction, amount.toPlainString(), traded, userId, error.getMessage()));
    }

    /**
     * Debit the base currency by the cost of {@code amount} units and credit those units.
     *
     * @throws TradeException INVALID_AMOUNT, INVALID_PAIR, STALE_RATES, UNKNOWN_CURRENCY or INSUFFICIENT_FUNDS
     */
    public TradeReceipt executeBuy(Portfolio portfolio, Currency currency, BigDecimal amount) {
        RateTable table = rateCache.current();
        Currency base = checkTradable(portfolio, currency, amount, table);

        BigDecimal rate = rateOf(table, currency, base);
        BigDecimal cost = Amounts.round(convert(table, amount, currency, base));
        if (cost.signum() == 0) {
            throw TradeException.amountTooSmall(amount, currency);
        }

        TradeReceipt receipt = receipt(portfolio, TradeDirection.BUY, currency, amount, rate, cost.negate(), table);
        portfolio.apply(receipt);

        log.info("User {} bought {} {} for {} {} at {} (rates version {})",
                portfolio.getUserId(), amount.toPlainString(), currency, cost.toPlainString(), base,
                rate.toPlainString(), table.getVersion());
        return receipt;
    }

    /**
     * Debit {@code amount} units and credit their value in the base currency.
     *
     * @throws TradeException INVALID_AMOUNT, INVALID_PAIR, STALE_RATES, UNKNOWN_CURRENCY or INSUFFICIENT_FUNDS
     */
    public TradeReceipt executeSell(Portfolio portfolio, Currency currency, BigDecimal amount) {
        RateTable table = rateCache.current();
        Currency base = checkTradable(portfolio, currency, amount, table);

        BigDecimal held = portfolio.balanceOf(currency);
        if (held.compareTo(amount) < 0) {
            throw TradeException.insufficientFunds(currency, held, amount);
        }

        BigDecimal rate = rateOf(table, currency, base);
        BigDecimal proceeds = Amounts.round(convert(table, amount, currency, base));
        if (proceeds.signum() == 0) {
            throw TradeException.amountTooSmall(amount, currency);
        }

        TradeReceipt receipt = receipt(portfolio, TradeDirection.SELL, currency, amount, rate, proceeds, table);
        portfolio.apply(receipt);

        log.info("User {} sold {} {} for {} {} at {} (rates version {})",
                portfolio.getUserId(), amount.toPlainString(), currency, proceeds.toPlainString(), base,
                rate.toPlainString(), table.getVersion());
        return receipt;
    }

    private Currency checkTradable(Portfolio portfolio, Currency currency, BigDecimal amount, RateTable table) {
        if (!Amounts.isPositive(amount)) {
            throw TradeException.invalidAmount(amount);
        }
        Currency base = portfolio.getBaseCurrency();
        if (currency == base) {
            throw TradeException.invalidPair(currency);
        }
        if (policy.rejectStaleRates() && table.isStale(policy.maxRateAge(), clock.instant())) {
            throw TradeException.staleRates(table.getAsOf(), policy.maxRateAge());
        }
        return base;
    }

    private BigDecimal rateOf(RateTable table, Currency currency, Currency base) {
        return convert(table, BigDecimal.ONE, currency, base);
    }

    private BigDecimal convert(RateTable table, BigDecimal amount, Currency from, Currency to) {
        try {
            return table.convert(amount, from, to);
        } catch (ConversionException e) {
            throw TradeException.unknownCurrency(from, e);
        }
    }

    private TradeReceipt receipt(
            Portfolio portfolio,
            TradeDirection direction,
            Currency currency,
            BigDecimal amount,
            BigDecimal rate,
            BigDecimal baseDelta,
            RateTable table
    ) {
        return TradeReceipt.builder()
                .id(UUID.randomUUID().toString())
                .userId(portfolio.getUserId())
                .currency(currency)
                .direction(direction)
                .amount(amount)
                .rateUsed(rate)
                .baseCurrency(portfolio.getBaseCurrency())
                .baseCurrencyDelta(baseDelta)
                .rateTableVersion(table.getVersion())
                .timestamp(clock.instant())
                .build();
    }
}
