package com.vth.application.service;

import com.vth.application.port.out.PortfolioRepository;
import com.vth.application.port.out.RateTableRepository;
import com.vth.domain.exception.ConversionException;
import com.vth.domain.exception.PortfolioNotFoundException;
import com.vth.domain.exception.TradeException;
import com.vth.domain.model.Currency;
import com.vth.domain.model.CurrencyKind;
import com.vth.domain.model.Portfolio;
import com.vth.domain.model.RateProvider;
import com.vth.domain.model.TradeDirection;
import com.vth.domain.model.TradeReceipt;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for TradeEngine
 * Rates: 1 EUR = 1.1 USD, 1 GBP = 1.25 USD, 1 BTC = 60000 USD
 */
class TradeEngineTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Mock
    private RateTableRepository rateTableRepository;

    @Mock
    private PortfolioRepository portfolioRepository;

    private AutoCloseable mocks;
    private MutableClock clock;
    private RateCache rateCache;
    private PortfolioService portfolioService;
    private TradeEngine engine;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(rateTableRepository.save(any())).thenReturn(Future.succeededFuture());
        when(portfolioRepository.save(any())).thenReturn(Future.succeededFuture());
        when(portfolioRepository.load(anyString())).thenReturn(Future.succeededFuture(Optional.empty()));

        clock = new MutableClock(T0);
        StubRateSource fiat = new StubRateSource(RateProvider.EXCHANGE_RATE_API, Currency.ofKind(CurrencyKind.FIAT), clock)
                .price(Currency.EUR, "1.1")
                .price(Currency.GBP, "1.25");
        StubRateSource crypto = new StubRateSource(RateProvider.COINGECKO, Currency.ofKind(CurrencyKind.CRYPTO), clock)
                .price(Currency.BTC, "60000");
        rateCache = new RateCache(Currency.USD, List.of(fiat, crypto), rateTableRepository, 10, clock);
        assertTrue(rateCache.refresh().succeeded());

        useEngine(TradePolicy.allowStale(Duration.ofMinutes(5)));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    private void useEngine(TradePolicy policy) {
        portfolioService = new PortfolioService(rateCache, portfolioRepository, policy, clock);
        engine = new TradeEngine(rateCache, portfolioService, policy, clock);
    }

    private Portfolio open(String userId, String seed) {
        Future<Portfolio> opened = portfolioService.openPortfolio(userId, new BigDecimal(seed));
        assertTrue(opened.succeeded());
        return opened.result();
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    void buyThenSell_shouldMoveBalancesAtTheCachedRate() {
        Portfolio portfolio = open("alice", "1000");

        Future<TradeReceipt> bought = engine.buy("alice", "EUR", new BigDecimal("100"));

        assertTrue(bought.succeeded());
        TradeReceipt buy = bought.result();
        assertEquals(TradeDirection.BUY, buy.getDirection());
        assertAmount("1.1", buy.getRateUsed());
        assertAmount("-110", buy.getBaseCurrencyDelta());
        assertEquals(1, buy.getRateTableVersion());
        assertAmount("890", portfolio.balanceOf(Currency.USD));
        assertAmount("100", portfolio.balanceOf(Currency.EUR));

        Future<TradeReceipt> sold = engine.sell("alice", "EUR", new BigDecimal("50"));

        assertTrue(sold.succeeded());
        assertAmount("55", sold.result().getBaseCurrencyDelta());
        assertAmount("945", portfolio.balanceOf(Currency.USD));
        assertAmount("50", portfolio.balanceOf(Currency.EUR));
        assertEquals(2, engine.tradeHistory("alice").result().size());
        verify(portfolioRepository, atLeastOnce()).save(portfolio);
    }

    @Test
    void sell_insufficientFundsShouldLeaveBalancesUnchanged() {
        Portfolio portfolio = open("bob", "1000");
        Map<Currency, BigDecimal> before = portfolio.balances();

        Future<TradeReceipt> result = engine.sell("bob", "BTC", new BigDecimal("1"));

        assertTrue(result.failed());
        TradeException error = assertInstanceOf(TradeException.class, result.cause());
        assertEquals(TradeException.Kind.INSUFFICIENT_FUNDS, error.getKind());
        assertEquals(Currency.BTC, error.getCurrency());
        assertAmount("0", error.getAvailable());
        assertAmount("1", error.getRequired());
        assertEquals(before, portfolio.balances());
        assertTrue(portfolio.trades().isEmpty());
    }

    @Test
    void buy_insufficientBaseFundsShouldReportTheBaseCurrency() {
        Portfolio portfolio = open("carol", "100");

        Future<TradeReceipt> result = engine.buy("carol", "BTC", new BigDecimal("1"));

        TradeException error = assertInstanceOf(TradeException.class, result.cause());
        assertEquals(Currency.USD, error.getCurrency());
        assertAmount("60000", error.getRequired());
        assertAmount("100", portfolio.balanceOf(Currency.USD));
        assertAmount("0", portfolio.balanceOf(Currency.BTC));
    }

    @Test
    void trade_shouldRejectNonPositiveAmounts() {
        open("dave", "1000");

        for (String amount : List.of("0", "-5")) {
            Future<TradeReceipt> result = engine.buy("dave", "EUR", new BigDecimal(amount));
            TradeException error = assertInstanceOf(TradeException.class, result.cause());
            assertEquals(TradeException.Kind.INVALID_AMOUNT, error.getKind());
        }
        assertInstanceOf(TradeException.class, engine.sell("dave", "EUR", null).cause());
    }

    @Test
    void trade_amountWorthLessThanSmallestUnitShouldBeRejected() {
        open("erin", "1000");

        Future<TradeReceipt> result = engine.buy("erin", "EUR", new BigDecimal("0.000000001"));

        TradeException error = assertInstanceOf(TradeException.class, result.cause());
        assertEquals(TradeException.Kind.INVALID_AMOUNT, error.getKind());
    }

    @Test
    void sell_tinyAmountNotHeldShouldBeInsufficientFunds() {
        open("grace", "1000");

        Future<TradeReceipt> result = engine.sell("grace", "EUR", new BigDecimal("0.000000001"));

        TradeException error = assertInstanceOf(TradeException.class, result.cause());
        assertEquals(TradeException.Kind.INSUFFICIENT_FUNDS, error.getKind());
        assertEquals(Currency.EUR, error.getCurrency());
        assertAmount("0", error.getAvailable());
    }

    @Test
    void trade_baseCurrencyShouldBeRejectedAsInvalidPair() {
        open("frank", "1000");

        TradeException error = assertInstanceOf(TradeException.class,
                engine.buy("frank", "USD", BigDecimal.TEN).cause());

        assertEquals(TradeException.Kind.INVALID_PAIR, error.getKind());
    }

    @Test
    void trade_unknownCodeShouldFailWithConversionError() {
        open("gina", "1000");

        ConversionException error = assertInstanceOf(ConversionException.class,
                engine.buy("gina", "XYZ", BigDecimal.TEN).cause());

        assertEquals("XYZ", error.getCurrencyCode());
    }

    @Test
    void trade_currencyWithoutRateShouldFailWithUnknownCurrency() {
        Portfolio portfolio = open("hank", "1000");

        TradeException error = assertInstanceOf(TradeException.class,
                engine.buy("hank", "JPY", BigDecimal.TEN).cause());

        assertEquals(TradeException.Kind.UNKNOWN_CURRENCY, error.getKind());
        assertEquals(Currency.JPY, error.getCurrency());
        assertAmount("1000", portfolio.balanceOf(Currency.USD));
    }

    @Test
    void trade_staleRatesShouldBeRejectedWhenPolicySaysSo() {
        useEngine(TradePolicy.rejectOlderThan(Duration.ofMinutes(5)));
        Portfolio portfolio = open("ivan", "1000");
        clock.advance(Duration.ofMinutes(10));

        TradeException error = assertInstanceOf(TradeException.class,
                engine.buy("ivan", "EUR", BigDecimal.TEN).cause());

        assertEquals(TradeException.Kind.STALE_RATES, error.getKind());
        assertAmount("1000", portfolio.balanceOf(Currency.USD));
    }

    @Test
    void trade_staleRatesShouldBeAcceptedByDefault() {
        open("judy", "1000");
        clock.advance(Duration.ofHours(2));

        assertTrue(engine.buy("judy", "EUR", BigDecimal.TEN).succeeded());
    }

    @Test
    void trade_unknownUserShouldFail() {
        assertInstanceOf(PortfolioNotFoundException.class, engine.buy("nobody", "EUR", BigDecimal.TEN).cause());
        assertInstanceOf(PortfolioNotFoundException.class, engine.tradeHistory("nobody").cause());
    }

    @Test
    void trade_persistenceFailureShouldKeepTheInMemoryTrade() {
        Portfolio portfolio = open("kim", "1000");
        when(portfolioRepository.save(any())).thenReturn(Future.failedFuture("disk full"));

        Future<TradeReceipt> result = engine.buy("kim", "EUR", new BigDecimal("100"));

        assertTrue(result.succeeded());
        assertAmount("890", portfolio.balanceOf(Currency.USD));
    }

    @Test
    void randomTradeSequence_shouldNeverDriveABalanceNegative() {
        Portfolio portfolio = open("leo", "1000");
        Random random = new Random(42);
        List<String> currencies = List.of("EUR", "GBP", "BTC");

        for (int i = 0; i < 500; i++) {
            String currency = currencies.get(random.nextInt(currencies.size()));
            BigDecimal amount = "BTC".equals(currency)
                    ? BigDecimal.valueOf(random.nextInt(2000) + 1, 5)
                    : BigDecimal.valueOf(random.nextInt(40000) + 1, 2);
            if (random.nextBoolean()) {
                engine.buy("leo", currency, amount);
            } else {
                engine.sell("leo", currency, amount);
            }
            portfolio.balances().forEach((c, balance) ->
                    assertTrue(balance.signum() >= 0, c + " went negative: " + balance));
        }

        // The base balance reconciles with the accepted receipts
        BigDecimal expectedBase = new BigDecimal("1000");
        for (TradeReceipt receipt : portfolio.trades()) {
            expectedBase = expectedBase.add(receipt.getBaseCurrencyDelta());
        }
        assertAmount(expectedBase.toPlainString(), portfolio.balanceOf(Currency.USD));
        assertFalse(portfolio.trades().isEmpty());
    }

    @Test
    void concurrentBuysOfOneUser_shouldNotOverspend() throws InterruptedException {
        Portfolio portfolio = open("mia", "1000");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(1000);
        AtomicInteger accepted = new AtomicInteger();
        List<Throwable> unexpected = java.util.Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < 1000; i++) {
            executor.submit(() -> {
                engine.buy("mia", "EUR", BigDecimal.ONE).onComplete(ar -> {
                    if (ar.succeeded()) {
                        accepted.incrementAndGet();
                    } else if (!(ar.cause() instanceof TradeException)) {
                        unexpected.add(ar.cause());
                    }
                    done.countDown();
                });
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(unexpected.isEmpty(), () -> "unexpected failures: " + unexpected);
        assertEquals(909, accepted.get());
        assertAmount("909", portfolio.balanceOf(Currency.EUR));
        assertAmount("0.1", portfolio.balanceOf(Currency.USD));
        assertEquals(909, portfolio.trades().size());
    }
}
