package com.vth.application.service;

import com.vth.application.port.in.PortfolioUseCase;
import com.vth.application.port.out.PortfolioRepository;
import com.vth.domain.exception.ConversionException;
import com.vth.domain.exception.PortfolioNotFoundException;
import com.vth.domain.model.Amounts;
import com.vth.domain.model.Currency;
import com.vth.domain.model.Portfolio;
import com.vth.domain.model.PortfolioValuation;
import com.vth.domain.model.RateTable;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Use case implementation for portfolio lifecycle and valuation.
 * Keeps loaded portfolios in memory; the in-memory instance is the source of truth and the
 * repository receives a snapshot after every change.
 */
@Slf4j
public class PortfolioService implements PortfolioUseCase {

    private final RateCache rateCache;
    private final PortfolioRepository repository;
    private final TradePolicy policy;
    private final Clock clock;
    private final Map<String, Portfolio> portfolios = new ConcurrentHashMap<>();

    public PortfolioService(RateCache rateCache, PortfolioRepository repository, TradePolicy policy, Clock clock) {
        this.rateCache = rateCache;
        this.repository = repository;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public Future<Portfolio> openPortfolio(String userId, BigDecimal seed) {
        return lookup(userId).compose(existing -> {
            if (existing.isPresent()) {
                log.info("Portfolio for user {} already exists", userId);
                return Future.succeededFuture(existing.get());
            }
            Portfolio created = Portfolio.open(userId, rateCache.baseCurrency(), seed);
            Portfolio winner = register(created);
            if (winner != created) {
                return Future.succeededFuture(winner);
            }
            log.info("Opened portfolio for user {} with seed {} {}", userId,
                    seed == null ? BigDecimal.ZERO : seed.toPlainString(), created.getBaseCurrency());
            return persist(created).map(created);
        });
    }

    /**
     * Portfolio of a user, loaded from the repository on first access
     */
    public Future<Portfolio> findPortfolio(String userId) {
        return lookup(userId).compose(found -> found
                .map(Future::succeededFuture)
                .orElseGet(() -> Future.failedFuture(new PortfolioNotFoundException(userId))));
    }

    @Override
    public Future<PortfolioValuation> getPortfolioValue(String userId, String baseCurrency) {
        return findPortfolio(userId).map(portfolio -> {
            Currency base = baseCurrency == null || baseCurrency.isBlank()
                    ? portfolio.getBaseCurrency()
                    : Currency.fromValue(baseCurrency);
            return valuate(portfolio, base, rateCache.current());
        });
    }

    @Override
    public Future<Portfolio> deposit(String userId, String currency, BigDecimal amount) {
        Currency target;
        try {
            target = Currency.fromValue(currency);
        } catch (ConversionException e) {
            return Future.failedFuture(e);
        }
        return findPortfolio(userId).compose(portfolio -> {
            portfolio.deposit(target, amount);
            log.info("Deposited {} {} for user {}", amount.toPlainString(), target, userId);
            return persist(portfolio).map(portfolio);
        });
    }

    /**
     * Convert every non-zero balance to {@code base} using one table.
     * Fails as a whole, naming the currency, when any balance cannot be converted.
     */
    public PortfolioValuation valuate(Portfolio portfolio, Currency base, RateTable table) {
        Map<Currency, BigDecimal> balances = portfolio.balances();
        List<PortfolioValuation.Line> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (Map.Entry<Currency, BigDecimal> balance : balances.entrySet()) {
            if (balance.getValue().signum() == 0) {
                continue;
            }
            Currency currency = balance.getKey();
            BigDecimal rate = table.convert(BigDecimal.ONE, currency, base);
            BigDecimal value = Amounts.round(table.convert(balance.getValue(), currency, base));
            lines.add(new PortfolioValuation.Line(currency, balance.getValue(), rate, value));
            total = total.add(value);
        }

        boolean stale = table.isStale(policy.maxRateAge(), clock.instant());
        log.debug("Valued portfolio of {} at {} {} (rates version {}, stale={})",
                portfolio.getUserId(), total.toPlainString(), base, table.getVersion(), stale);
        return new PortfolioValuation(portfolio.getUserId(), base, total, List.copyOf(lines),
                table.getVersion(), table.getAsOf(), stale);
    }

    /**
     * Save a snapshot; a failure is logged and the in-memory state stands
     */
    Future<Void> persist(Portfolio portfolio) {
        return repository.save(portfolio)
                .recover(error -> {
                    log.error("Failed to persist portfolio of user {}, in-memory state kept", portfolio.getUserId(), error);
                    return Future.succeededFuture();
                });
    }

    private Future<Optional<Portfolio>> lookup(String userId) {
        if (userId == null || userId.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("userId is required"));
        }
        Portfolio cached = portfolios.get(userId);
        if (cached != null) {
            return Future.succeededFuture(Optional.of(cached));
        }
        return repository.load(userId).map(loaded -> loaded.map(this::register));
    }

    // Two concurrent loads of the same user settle on one instance
    private Portfolio register(Portfolio portfolio) {
        Portfolio existing = portfolios.putIfAbsent(portfolio.getUserId(), portfolio);
        return existing != null ? existing : portfolio;
    }
}
