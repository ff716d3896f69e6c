package com.vth.application.port.out;

import com.vth.domain.model.RateTable;
import io.vertx.core.Future;

import java.util.List;
import java.util.Optional;

/**
 * Output port for persisting rate tables
 */
public interface RateTableRepository {

    /**
     * Load the last saved rate table
     * @return Future with the table, empty if nothing was saved yet
     */
    Future<Optional<RateTable>> load();

    /**
     * Save a table as the current one and append it to the stored history
     */
    Future<Void> save(RateTable table);

    /**
     * Load stored past tables, oldest first
     */
    Future<List<RateTable>> loadHistory();
}
