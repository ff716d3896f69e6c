package com.vth.application.port.out;

import com.vth.domain.model.Currency;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import io.vertx.core.Future;

import java.util.List;
import java.util.Set;

/**
 * Output port for one external rate provider.
 * Adding a provider means adding an implementation; the rate cache does not change.
 */
public interface RateSource {

    /**
     * Provider this source talks to, used to tag entries and in logs
     */
    RateProvider provider();

    /**
     * Currencies this source is able to quote
     */
    Set<Currency> supportedCurrencies();

    /**
     * Fetch current prices in the base currency for the requested currencies.
     * Currencies the source does not support are ignored.
     *
     * @return entries in request order, or a failed future carrying a
     *         {@link com.vth.domain.exception.FetchException}
     */
    Future<List<RateEntry>> fetch(Set<Currency> currencies);
}
