package com.vth.application.port.out;

import com.vth.domain.model.Portfolio;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for persisting portfolio snapshots
 */
public interface PortfolioRepository {

    /**
     * Load a user's portfolio
     * @param userId User identifier
     * @return Future with the portfolio, empty if the user has none
     */
    Future<Optional<Portfolio>> load(String userId);

    /**
     * Save a snapshot of the portfolio as it is when the write happens
     */
    Future<Void> save(Portfolio portfolio);
}
