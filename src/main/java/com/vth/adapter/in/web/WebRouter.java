package com.vth.adapter.in.web;

import com.vth.adapter.in.web.portfolio.PortfolioHandler;
import com.vth.adapter.in.web.rates.RateHandler;
import com.vth.adapter.in.web.trade.TradeHandler;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for rate and portfolio endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    private final Router router;
    private final RateHandler rateHandler;
    private final PortfolioHandler portfolioHandler;
    private final TradeHandler buyHandler;
    private final TradeHandler sellHandler;

    public void setupRoutes() {
        // CORS headers
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        // Handle OPTIONS preflight requests
        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.route("/api/*").handler(BodyHandler.create());

        // Rates
        router.post("/api/rates/refresh").handler(rateHandler::refresh);
        router.get("/api/rates").handler(rateHandler::current);
        router.get("/api/rates/history").handler(rateHandler::history);
        router.get("/api/rates/convert").handler(rateHandler::convert);

        // Portfolios
        router.post("/api/portfolios/:userId").handler(portfolioHandler::open);
        router.get("/api/portfolios/:userId/value").handler(portfolioHandler::value);
        router.post("/api/portfolios/:userId/deposit").handler(portfolioHandler::deposit);
        router.get("/api/portfolios/:userId/trades").handler(portfolioHandler::trades);

        // Trading
        router.post("/api/portfolios/:userId/buy").handler(buyHandler);
        router.post("/api/portfolios/:userId/sell").handler(sellHandler);

        // Health check endpoint
        router.get("/health")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"status\":\"UP\",\"service\":\"valutatrade-hub\"}");
                });

        // Root endpoint
        router.get("/")
                .handler(ctx -> {
                    ctx.response()
                            .putHeader("Content-Type", "application/json")
                            .end("{\"name\":\"ValutaTrade Hub\",\"version\":\"1.0.0\"}");
                });
    }
}
