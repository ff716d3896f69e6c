package com.vth.adapter.out.http;

import com.vth.application.port.out.RateSource;
import com.vth.domain.exception.FetchException;
import com.vth.domain.model.Currency;
import com.vth.domain.model.CurrencyKind;
import com.vth.domain.model.RateEntry;
import com.vth.domain.model.RateProvider;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Crypto rate source backed by the CoinGecko simple price endpoint.
 * Prices come back directly in the base currency, keyed by coin id.
 */
@Slf4j
public class CoinGeckoSource implements RateSource {

    private static final Set<Currency> SUPPORTED = Currency.ofKind(CurrencyKind.CRYPTO);

    private final WebClient webClient;
    private final String baseUrl;
    private final String apiKey;
    private final Currency baseCurrency;
    private final long timeoutMs;
    private final Clock clock;

    public CoinGeckoSource(WebClient webClient, String baseUrl, String apiKey,
                           Currency baseCurrency, long timeoutMs, Clock clock) {
        this.webClient = webClient;
        this.baseUrl = ExchangeRateApiSource.stripTrailingSlash(baseUrl);
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseCurrency = baseCurrency;
        this.timeoutMs = timeoutMs;
        this.clock = clock;
    }

    @Override
    public RateProvider provider() {
        return RateProvider.COINGECKO;
    }

    @Override
    public Set<Currency> supportedCurrencies() {
        return SUPPORTED;
    }

    @Override
    public Future<List<RateEntry>> fetch(Set<Currency> currencies) {
        List<Currency> wanted = currencies.stream()
                .filter(SUPPORTED::contains)
                .sorted()
                .collect(Collectors.toList());
        if (wanted.isEmpty()) {
            return Future.succeededFuture(List.of());
        }

        String ids = wanted.stream().map(Currency::getCoinGeckoId).collect(Collectors.joining(","));
        String vsCurrency = baseCurrency.getCode().toLowerCase(Locale.ROOT);
        log.info("Fetching crypto prices from CoinGecko for ids={}", ids);

        HttpRequest<Buffer> request = webClient.getAbs(baseUrl + "/simple/price")
                .addQueryParam("ids", ids)
                .addQueryParam("vs_currencies", vsCurrency)
                .timeout(timeoutMs);
        if (!apiKey.isBlank()) {
            request.putHeader("x-cg-pro-api-key", apiKey);
        }

        return request.send()
                .recover(error -> Future.failedFuture(HttpSourceSupport.translate(provider(), error)))
                .map(response -> parse(HttpSourceSupport.jsonBody(provider(), response), wanted, vsCurrency));
    }

    private List<RateEntry> parse(JsonObject body, List<Currency> wanted, String vsCurrency) {
        Instant fetchedAt = clock.instant();
        List<RateEntry> entries = new ArrayList<>();
        for (Currency currency : wanted) {
            Object coin = body.getValue(currency.getCoinGeckoId());
            if (!(coin instanceof JsonObject) || ((JsonObject) coin).getValue(vsCurrency) == null) {
                log.warn("CoinGecko returned no {} price for {}", vsCurrency, currency.getCoinGeckoId());
                continue;
            }
            JsonObject prices = (JsonObject) coin;
            entries.add(new RateEntry(
                    currency,
                    HttpSourceSupport.positiveQuote(provider(), currency, prices.getValue(vsCurrency)),
                    fetchedAt,
                    provider()
            ));
        }

        if (entries.isEmpty()) {
            throw FetchException.badResponse(provider(), "no prices for " + wanted);
        }
        log.info("Fetched {} crypto prices from CoinGecko", entries.size());
        return entries;
    }
}
