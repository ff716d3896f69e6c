package com.vth.adapter.out.http;

import com.vth.application.port.out.RateSource;
import com.vth.domain.exception.FetchException;
import com.vth.domain.model.Amounts;
import com.vth.domain.model.Currency;
import com.vth.domain.model.CurrencyKind;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fiat rate source backed by ExchangeRate-API v6.
 * Calls {@code GET {baseUrl}/{apiKey}/latest/{base}}; the response quotes how many units of each
 * currency one unit of the base buys, so the price in base is the reciprocal.
 */
@Slf4j
public class ExchangeRateApiSource implements RateSource {

    private static final Set<Currency> SUPPORTED = Currency.ofKind(CurrencyKind.FIAT);

    private final WebClient webClient;
    private final String baseUrl;
    private final String apiKey;
    private final Currency baseCurrency;
    private final long timeoutMs;
    private final Clock clock;

    public ExchangeRateApiSource(WebClient webClient, String baseUrl, String apiKey,
                                 Currency baseCurrency, long timeoutMs, Clock clock) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("ExchangeRate-API key is not configured");
        }
        this.webClient = webClient;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey.trim();
        this.baseCurrency = baseCurrency;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    @Override
    public RateProvider provider() {
        return RateProvider.EXCHANGE_RATE_API;
    }

    @Override
    public Set<Currency> supportedCurrencies() {
        return SUPPORTED;
    }

    @Override
    public Future<List<RateEntry>> fetch(Set<Currency> currencies) {
        List<Currency> wanted = new ArrayList<>();
        for (Currency currency : currencies) {
            if (SUPPORTED.contains(currency) && currency != baseCurrency) {
                wanted.add(currency);
            }
        }
        if (wanted.isEmpty()) {
            return Future.succeededFuture(List.of());
        }

        log.info("Fetching {} fiat rates from ExchangeRate-API", wanted.size());
        String url = baseUrl + "/" + apiKey + "/latest/" + baseCurrency.getCode();

        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .recover(error -> Future.failedFuture(HttpSourceSupport.translate(provider(), error)))
                .map(response -> parse(HttpSourceSupport.jsonBody(provider(), response), wanted));
    }

    private List<RateEntry> parse(JsonObject body, List<Currency> wanted) {
        if (!"success".equals(body.getString("result"))) {
            String errorType = body.getString("error-type", "unknown error");
            if ("quota-reached".equals(errorType)) {
                throw FetchException.rateLimited(provider(), errorType);
            }
            throw FetchException.badResponse(provider(), errorType);
        }

        Object rates = body.getValue("conversion_rates");
        if (!(rates instanceof JsonObject)) {
            throw FetchException.badResponse(provider(), "missing 'conversion_rates'");
        }
        JsonObject conversionRates = (JsonObject) rates;

        Instant fetchedAt = clock.instant();
        List<RateEntry> entries = new ArrayList<>();
        for (Currency currency : wanted) {
            Object value = conversionRates.getValue(currency.getCode());
            if (value == null) {
                log.warn("ExchangeRate-API returned no quote for {}", currency);
                continue;
            }
            BigDecimal unitsPerBase = HttpSourceSupport.positiveQuote(provider(), currency, value);
            BigDecimal priceInBase = BigDecimal.ONE.divide(unitsPerBase, Amounts.MATH_CONTEXT);
            entries.add(new RateEntry(currency, priceInBase, fetchedAt, provider()));
        }

        if (entries.isEmpty()) {
            throw FetchException.badResponse(provider(), "no quotes for " + wanted);
        }
        log.info("Fetched {} fiat rates from ExchangeRate-API", entries.size());
        return entries;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
