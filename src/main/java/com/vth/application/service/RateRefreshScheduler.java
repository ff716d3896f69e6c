package com.vth.application.service;

import com.vth.application.port.in.RateRefreshUseCase;
import com.vth.domain.model.Currency;
import com.vth.domain.model.RateTable;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Use case implementation for rate refresh operations
 * Drives the rate cache on a Vert.x periodic timer and serves manual refreshes.
 * Scheduled and manual refreshes share the cache's in-flight guard: a tick that finds a
 * refresh running is skipped, a manual refresh waits for the running one and reuses its result.
 */
@Slf4j
public class RateRefreshScheduler implements RateRefreshUseCase {

    private final Vertx vertx;
    private final RateCache rateCache;
    private final Duration interval;
    private Long timerId;

    public RateRefreshScheduler(Vertx vertx, RateCache rateCache, Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Refresh interval must be positive: " + interval);
        }
        this.vertx = vertx;
        this.rateCache = rateCache;
        this.interval = interval;
    }

    @Override
    public Future<Void> startPeriodicRefresh() {
        log.info("Starting rate refresh scheduler (interval: {})", interval);

        // Initial refresh; a failure leaves the restored or base-only table in place
        return refreshRates()
                .<Void>mapEmpty()
                .recover(error -> {
                    log.warn("Initial rate refresh failed, serving previously stored rates: {}", error.getMessage());
                    return Future.succeededFuture();
                })
                .onSuccess(v -> {
                    timerId = vertx.setPeriodic(interval.toMillis(), id -> onTick());
                    log.info("Rate refresh scheduler started successfully");
                });
    }

    @Override
    public void stopPeriodicRefresh() {
        if (timerId != null) {
            vertx.cancelTimer(timerId);
            timerId = null;
            log.info("Rate refresh scheduler stopped");
        }
    }

    /**
     * One timer tick. Skipped, not queued, while another refresh is running.
     */
    void onTick() {
        rateCache.refreshIfIdle().ifPresentOrElse(
                refresh -> {
                    log.info("Periodic rate refresh triggered");
                    refresh.onFailure(error -> log.error("Periodic rate refresh failed", error));
                },
                () -> log.info("Periodic rate refresh skipped, a refresh is already in progress")
        );
    }

    @Override
    public Future<RateTable> refreshRates() {
        return rateCache.refresh();
    }

    @Override
    public RateTable currentRates() {
        return rateCache.current();
    }

    @Override
    public List<RateTable> rateHistory() {
        return rateCache.history();
    }

    @Override
    public BigDecimal convert(BigDecimal amount, String from, String to) {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
        return rateCache.convert(amount, Currency.fromValue(from), Currency.fromValue(to));
    }

    boolean isRunning() {
        return timerId != null;
    }
}
