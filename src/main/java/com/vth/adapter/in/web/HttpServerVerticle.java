package com.vth.adapter.in.web;

import com.vth.adapter.in.web.portfolio.PortfolioHandler;
import com.vth.adapter.in.web.rates.RateHandler;
import com.vth.adapter.in.web.trade.TradeHandler;
import com.vth.adapter.out.http.CoinGeckoSource;
import com.vth.adapter.out.http.ExchangeRateApiSource;
import com.vth.adapter.out.persistence.JsonFilePortfolioRepository;
import com.vth.adapter.out.persistence.JsonFileRateTableRepository;
import com.vth.application.port.out.PortfolioRepository;
import com.vth.application.port.out.RateSource;
import com.vth.application.port.out.RateTableRepository;
import com.vth.application.service.PortfolioService;
import com.vth.application.service.RateCache;
import com.vth.application.service.RateRefreshScheduler;
import com.vth.application.service.TradeEngine;
import com.vth.domain.model.TradeDirection;
import com.vth.infrastructure.config.AppConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private final Clock clock;

    private AppConfig appConfig;
    private WebClient webClient;
    private RateTableRepository rateTableRepository;
    private RateCache rateCache;
    private RateRefreshScheduler rateRefreshScheduler;
    private PortfolioService portfolioService;
    private TradeEngine tradeEngine;
    private HttpServer server;

    public HttpServerVerticle() {
        this(Clock.systemUTC());
    }

    public HttpServerVerticle(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        Future.succeededFuture()
                .compose(v -> initializeServices())
                .compose(v -> restoreRates())
                .compose(v -> {
                    log.info("Starting rate refresh scheduler...");
                    return rateRefreshScheduler.startPeriodicRefresh();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (rateRefreshScheduler != null) {
            rateRefreshScheduler.stopPeriodicRefresh();
        }
        if (webClient != null) {
            webClient.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    /**
     * Port the server is bound to, useful when configured with port 0
     */
    public int actualPort() {
        return server == null ? -1 : server.actualPort();
    }

    private Future<Void> initializeServices() {
        try {
            appConfig = AppConfig.fromJson(config());
            log.info("Configuration: {}", appConfig);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        webClient = WebClient.create(vertx);

        // Output ports (adapters)
        rateTableRepository = new JsonFileRateTableRepository(vertx, appConfig.getDataDir(), appConfig.getMaxHistoryEntries());
        PortfolioRepository portfolioRepository = new JsonFilePortfolioRepository(vertx, appConfig.getDataDir());

        List<RateSource> sources = new ArrayList<>();
        if (appConfig.hasExchangeRateApiKey()) {
            sources.add(new ExchangeRateApiSource(webClient, appConfig.getExchangeRateApiUrl(),
                    appConfig.getExchangeRateApiKey(), appConfig.getBaseCurrency(), appConfig.getRequestTimeoutMs(), clock));
        } else {
            log.warn("No ExchangeRate-API key configured (sources.exchangeRateApi.apiKey or {}), fiat rates will not refresh",
                    AppConfig.EXCHANGERATE_API_KEY_ENV);
        }
        sources.add(new CoinGeckoSource(webClient, appConfig.getCoinGeckoUrl(), appConfig.getCoinGeckoApiKey(),
                appConfig.getBaseCurrency(), appConfig.getRequestTimeoutMs(), clock));

        // Application services (use cases)
        rateCache = new RateCache(appConfig.getBaseCurrency(), sources, rateTableRepository, appConfig.getHistorySize(), clock);
        rateRefreshScheduler = new RateRefreshScheduler(vertx, rateCache, appConfig.getRefreshInterval());
        portfolioService = new PortfolioService(rateCache, portfolioRepository, appConfig.tradePolicy(), clock);
        tradeEngine = new TradeEngine(rateCache, portfolioService, appConfig.tradePolicy(), clock);

        log.info("Services wired up with {} rate sources", sources.size());
        return Future.succeededFuture();
    }

    // A missing or unreadable store starts from the base-only table
    private Future<Void> restoreRates() {
        return rateTableRepository.load()
                .compose(stored -> {
                    if (stored.isEmpty()) {
                        return Future.<Void>succeededFuture();
                    }
                    return rateTableRepository.loadHistory()
                            .map(history -> {
                                rateCache.restore(stored.get(), history);
                                return (Void) null;
                            });
                })
                .recover(error -> {
                    log.warn("Could not restore stored rates, starting empty: {}", error.getMessage());
                    return Future.succeededFuture();
                });
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());

        RateHandler rateHandler = new RateHandler(rateRefreshScheduler, appConfig.getMaxRateAge(), clock);
        PortfolioHandler portfolioHandler = new PortfolioHandler(portfolioService, tradeEngine);
        WebRouter webRouter = new WebRouter(
                router,
                rateHandler,
                portfolioHandler,
                new TradeHandler(tradeEngine, TradeDirection.BUY),
                new TradeHandler(tradeEngine, TradeDirection.SELL)
        );
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> {
            ctx.response()
                    .setStatusCode(404)
                    .putHeader("Content-Type", "application/json")
                    .end(new JsonObject()
                            .put("status", "error")
                            .put("message", "Endpoint not found")
                            .encode()
                    );
        });

        int port = appConfig.getHttpPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }
}
