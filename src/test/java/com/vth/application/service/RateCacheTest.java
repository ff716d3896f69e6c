package com.vth.application.service;

import com.vth.application.port.out.RateTableRepository;
import com.vth.domain.exception.FetchException;
import com.vth.domain.exception.RefreshException;
import com.vth.domain.model.Currency;
import com.vth.domain.model.CurrencyKind;
import com.vth.domain.model.RateProvider;
import com.vth.domain.model.RateTable;
import io.vertx.core.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit test for RateCache
 * Sources are stubs completing synchronously unless held
 */
class RateCacheTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Mock
    private RateTableRepository repository;

    private AutoCloseable mocks;
    private MutableClock clock;
    private StubRateSource fiat;
    private StubRateSource crypto;
    private RateCache cache;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        when(repository.save(any())).thenReturn(Future.succeededFuture());

        clock = new MutableClock(T0);
        fiat = new StubRateSource(RateProvider.EXCHANGE_RATE_API, Currency.ofKind(CurrencyKind.FIAT), clock)
                .price(Currency.EUR, "1.1")
                .price(Currency.GBP, "1.25");
        crypto = new StubRateSource(RateProvider.COINGECKO, Currency.ofKind(CurrencyKind.CRYPTO), clock)
                .price(Currency.BTC, "60000");
        cache = new RateCache(Currency.USD, List.of(fiat, crypto), repository, 3, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void current_beforeAnyRefreshShouldBeBaseOnly() {
        RateTable table = cache.current();

        assertEquals(0, table.getVersion());
        assertEquals(java.util.Set.of(Currency.USD), table.currencies());
        assertTrue(cache.isStale(Duration.ofMinutes(5)));
    }

    @Test
    void refresh_shouldMergeAllSourcesAndPersist() {
        Future<RateTable> result = cache.refresh();

        assertTrue(result.succeeded());
        RateTable table = result.result();
        assertSame(table, cache.current());
        assertEquals(1, table.getVersion());
        assertEquals(java.util.Set.of(Currency.USD, Currency.EUR, Currency.GBP, Currency.BTC), table.currencies());
        assertEquals(T0, table.getAsOf());
        assertEquals(0, new BigDecimal("110").compareTo(cache.convert(new BigDecimal("100"), Currency.EUR, Currency.USD)));
        verify(repository, times(1)).save(table);
    }

    @Test
    void refresh_partialFailureShouldKeepPreviousEntriesOfFailedSource() {
        cache.refresh();
        RateTable first = cache.current();

        clock.advance(Duration.ofMinutes(15));
        fiat.price(Currency.EUR, "1.2");
        crypto.failWith(FetchException.timeout(RateProvider.COINGECKO, "timed out after 10000 ms", null));

        Future<RateTable> result = cache.refresh();

        assertTrue(result.succeeded());
        RateTable second = cache.current();
        assertEquals(2, second.getVersion());
        assertEquals(0, new BigDecimal("1.2").compareTo(second.rate(Currency.EUR)));
        assertEquals(T0.plus(Duration.ofMinutes(15)), second.entry(Currency.EUR).orElseThrow().getFetchedAt());
        // BTC survives with its old price and old fetch time
        assertEquals(first.entry(Currency.BTC), second.entry(Currency.BTC));
        assertEquals(T0, second.entry(Currency.BTC).orElseThrow().getFetchedAt());
        assertEquals(T0, second.getAsOf());
    }

    @Test
    void refresh_allSourcesFailedShouldLeaveCurrentUntouched() {
        cache.refresh();
        RateTable before = cache.current();

        fiat.failWith(FetchException.rateLimited(RateProvider.EXCHANGE_RATE_API, "HTTP 429"));
        crypto.failWith(FetchException.badResponse(RateProvider.COINGECKO, "HTTP 500"));

        Future<RateTable> result = cache.refresh();

        assertTrue(result.failed());
        RefreshException error = assertInstanceOf(RefreshException.class, result.cause());
        assertEquals(RefreshException.Kind.ALL_SOURCES_FAILED, error.getKind());
        assertEquals(2, error.getSuppressed().length);
        assertSame(before, cache.current());
        assertFalse(cache.isRefreshInProgress());
        verify(repository, times(1)).save(any());
    }

    @Test
    void refresh_withoutSourcesShouldFail() {
        RateCache empty = new RateCache(Currency.USD, List.of(), repository, 3, clock);

        Future<RateTable> result = empty.refresh();

        assertTrue(result.failed());
        assertInstanceOf(RefreshException.class, result.cause());
        verify(repository, never()).save(any());
    }

    @Test
    void refresh_sourceThrowingSynchronouslyShouldCountAsFailure() {
        StubRateSource broken = new StubRateSource(RateProvider.COINGECKO, Currency.ofKind(CurrencyKind.CRYPTO), clock) {
            @Override
            public Future<List<com.vth.domain.model.RateEntry>> fetch(java.util.Set<Currency> currencies) {
                throw new IllegalStateException("boom");
            }
        };
        RateCache mixed = new RateCache(Currency.USD, List.of(fiat, broken), repository, 3, clock);

        Future<RateTable> result = mixed.refresh();

        assertTrue(result.succeeded());
        assertTrue(result.result().contains(Currency.EUR));
        assertFalse(result.result().contains(Currency.BTC));
    }

    @Test
    void refresh_shouldDropEntriesTheSourceWasNotAskedFor() {
        crypto.price(Currency.EUR, "99");

        RateTable table = cache.refresh().result();

        assertEquals(0, new BigDecimal("1.1").compareTo(table.rate(Currency.EUR)));
    }

    @Test
    void refresh_whileInFlightShouldJoinTheRunningRefresh() {
        fiat.hold();
        crypto.hold();

        Future<RateTable> first = cache.refresh();
        Future<RateTable> second = cache.refresh();

        assertFalse(first.isComplete());
        assertSame(first, second);
        assertTrue(cache.isRefreshInProgress());
        assertEquals(1, fiat.calls());
        assertEquals(1, crypto.calls());

        fiat.release();
        crypto.release();

        assertTrue(first.succeeded());
        assertSame(first.result(), second.result());
        assertEquals(1, cache.current().getVersion());
        assertFalse(cache.isRefreshInProgress());
    }

    @Test
    void refreshIfIdle_shouldSkipWhileAnotherRefreshRuns() {
        fiat.hold();
        crypto.hold();
        Future<RateTable> running = cache.refresh();

        Optional<Future<RateTable>> skipped = cache.refreshIfIdle();

        assertTrue(skipped.isEmpty());
        fiat.release();
        crypto.release();
        assertTrue(running.succeeded());

        Optional<Future<RateTable>> next = cache.refreshIfIdle();
        assertTrue(next.isPresent());
        assertEquals(2, next.get().result().getVersion());
    }

    @Test
    void history_shouldKeepReplacedTablesNewestFirstUpToTheLimit() {
        for (int i = 0; i < 5; i++) {
            clock.advance(Duration.ofMinutes(1));
            cache.refresh();
        }

        List<RateTable> history = cache.history();

        assertEquals(5, cache.current().getVersion());
        assertEquals(3, history.size());
        assertEquals(List.of(4L, 3L, 2L), history.stream().map(RateTable::getVersion).collect(java.util.stream.Collectors.toList()));
    }

    @Test
    void refresh_saveFailureShouldNotFailTheRefresh() {
        when(repository.save(any())).thenReturn(Future.failedFuture("disk full"));

        Future<RateTable> result = cache.refresh();

        assertTrue(result.succeeded());
        assertEquals(1, cache.current().getVersion());
    }

    @Test
    void restore_shouldInstallStoredTableAndContinueVersioning() {
        RateTable v1 = RateTable.baseOnly(Currency.USD, T0).merge(
                List.of(new com.vth.domain.model.RateEntry(Currency.JPY, new BigDecimal("0.0067"), T0, RateProvider.EXCHANGE_RATE_API)), T0);
        RateTable v2 = v1.merge(List.of(), T0);

        assertTrue(cache.restore(v2, List.of(v1, v2)));

        assertSame(v2, cache.current());
        assertEquals(List.of(v1), cache.history());

        RateTable v3 = cache.refresh().result();
        assertEquals(3, v3.getVersion());
        // Fetched currencies are overlaid on the restored ones
        assertTrue(v3.contains(Currency.JPY));
        assertEquals(List.of(v2, v1), cache.history());
    }

    @Test
    void restore_afterPublishShouldBeIgnored() {
        cache.refresh();
        RateTable published = cache.current();

        boolean restored = cache.restore(RateTable.baseOnly(Currency.USD, T0).merge(List.of(), T0), List.of());

        assertFalse(restored);
        assertSame(published, cache.current());
    }

    @Test
    void restore_withDifferentBaseShouldBeIgnored() {
        assertFalse(cache.restore(RateTable.baseOnly(Currency.EUR, T0).merge(List.of(), T0), List.of()));
        assertEquals(0, cache.current().getVersion());
    }
}
