package com.vth.infrastructure.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vth.application.service.TradePolicy;
import com.vth.domain.model.Currency;
import io.vertx.core.json.JsonObject;
import lombok.Getter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Typed view of {@code application.yml}, with defaults for every setting.
 * Provider API keys left blank in the file are taken from the environment.
 */
@Getter
@ToString(exclude = {"exchangeRateApiKey", "coinGeckoApiKey"})
public class AppConfig {

    public static final String EXCHANGERATE_API_KEY_ENV = "EXCHANGERATE_API_KEY";
    public static final String COINGECKO_API_KEY_ENV = "COINGECKO_API_KEY";

    private static final int DEFAULT_PORT = 8080;

    private final int httpPort;
    private final Currency baseCurrency;
    private final Duration refreshInterval;
    private final int historySize;
    private final long requestTimeoutMs;
    private final String exchangeRateApiUrl;
    private final String exchangeRateApiKey;
    private final String coinGeckoUrl;
    private final String coinGeckoApiKey;
    private final boolean rejectStaleRates;
    private final Duration maxRateAge;
    private final String dataDir;
    private final int maxHistoryEntries;

    private AppConfig(JsonObject root, Map<String, String> env) {
        JsonObject http = section(root, "http");
        JsonObject rates = section(root, "rates");
        JsonObject sources = section(root, "sources");
        JsonObject exchangeRateApi = section(sources, "exchangeRateApi");
        JsonObject coinGecko = section(sources, "coinGecko");
        JsonObject trading = section(root, "trading");
        JsonObject storage = section(root, "storage");

        this.httpPort = http.getInteger("port", DEFAULT_PORT);
        this.baseCurrency = Currency.fromValue(rates.getString("baseCurrency", "USD"));
        this.refreshInterval = Duration.ofMinutes(rates.getLong("refreshIntervalMinutes", 15L));
        this.historySize = rates.getInteger("historySize", 100);
        this.requestTimeoutMs = sources.getLong("requestTimeoutMs", 10_000L);
        this.exchangeRateApiUrl = exchangeRateApi.getString("url", "https://v6.exchangerate-api.com/v6");
        this.exchangeRateApiKey = keyOrEnv(exchangeRateApi.getString("apiKey"), env.get(EXCHANGERATE_API_KEY_ENV));
        this.coinGeckoUrl = coinGecko.getString("url", "https://api.coingecko.com/api/v3");
        this.coinGeckoApiKey = keyOrEnv(coinGecko.getString("apiKey"), env.get(COINGECKO_API_KEY_ENV));
        this.rejectStaleRates = trading.getBoolean("rejectStaleRates", false);
        this.maxRateAge = parseDuration("trading.maxRateAge", trading.getString("maxRateAge", "PT5M"));
        this.dataDir = storage.getString("dataDir", "data");
        this.maxHistoryEntries = storage.getInteger("maxHistoryEntries", 1000);

        validate();
    }

    public static AppConfig fromJson(JsonObject root) {
        return fromJson(root, System.getenv());
    }

    public static AppConfig fromJson(JsonObject root, Map<String, String> env) {
        return new AppConfig(root == null ? new JsonObject() : root, env);
    }

    /**
     * Read a YAML resource from the classpath into a JsonObject
     */
    public static JsonObject loadYaml(String resource) {
        try (InputStream is = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }
            Map<String, Object> content = new YAMLMapper().readValue(is, new TypeReference<Map<String, Object>>() {
            });
            return content == null ? new JsonObject() : new JsonObject(content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    public TradePolicy tradePolicy() {
        return rejectStaleRates ? TradePolicy.rejectOlderThan(maxRateAge) : TradePolicy.allowStale(maxRateAge);
    }

    public boolean hasExchangeRateApiKey() {
        return exchangeRateApiKey != null;
    }

    private void validate() {
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http.port out of range: " + httpPort);
        }
        if (refreshInterval.isZero() || refreshInterval.isNegative()) {
            throw new IllegalArgumentException("rates.refreshIntervalMinutes must be positive");
        }
        if (historySize < 0) {
            throw new IllegalArgumentException("rates.historySize must not be negative");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("sources.requestTimeoutMs must be positive");
        }
        if (maxHistoryEntries < 1) {
            throw new IllegalArgumentException("storage.maxHistoryEntries must be at least 1");
        }
    }

    private static JsonObject section(JsonObject parent, String name) {
        JsonObject section = parent.getJsonObject(name);
        return section == null ? new JsonObject() : section;
    }

    private static String keyOrEnv(String configured, String fromEnv) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return null;
    }

    private static Duration parseDuration(String key, String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " is not an ISO-8601 duration: " + value, e);
        }
    }
}
