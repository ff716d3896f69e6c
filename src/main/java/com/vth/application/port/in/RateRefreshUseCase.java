package com.vth.application.port.in;

import com.vth.domain.model.RateTable;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.util.List;

/**
 * Input port for rate refresh and conversion
 */
public interface RateRefreshUseCase {

    /**
     * Start the periodic refresh service
     * Performs an initial refresh immediately, then schedules periodic refreshes
     */
    Future<Void> startPeriodicRefresh();

    /**
     * Stop the periodic refresh service
     */
    void stopPeriodicRefresh();

    /**
     * Manually trigger a refresh of the rates.
     * Joins a refresh that is already running instead of starting a second one.
     */
    Future<RateTable> refreshRates();

    /**
     * Latest successfully merged table
     */
    RateTable currentRates();

    /**
     * Past tables, newest first
     */
    List<RateTable> rateHistory();

    /**
     * Convert an amount through the current table
     */
    BigDecimal convert(BigDecimal amount, String from, String to);
}
