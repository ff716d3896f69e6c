package com.vth.adapter.in.web.portfolio;

import com.vth.adapter.in.web.ErrorResponses;
import com.vth.adapter.in.web.dto.AmountRequest;
import com.vth.adapter.in.web.dto.ApiResponse;
import com.vth.adapter.in.web.trade.TradeReceiptResponse;
import com.vth.application.port.in.PortfolioUseCase;
import com.vth.application.port.in.TradeUseCase;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.Collectors;

/**
 * HTTP handlers for portfolio lifecycle, valuation and history
 */
@Slf4j
@RequiredArgsConstructor
public class PortfolioHandler {

    private final PortfolioUseCase portfolioUseCase;
    private final TradeUseCase tradeUseCase;

    public void open(RoutingContext context) {
        String userId = context.pathParam("userId");
        OpenPortfolioRequest request;
        try {
            JsonObject body = context.body().asJsonObject();
            request = body == null ? new OpenPortfolioRequest(null) : body.mapTo(OpenPortfolioRequest.class);
        } catch (IllegalArgumentException | DecodeException e) {
            ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Invalid request format: " + e.getMessage());
            return;
        }

        portfolioUseCase.openPortfolio(userId, request.seed())
                .onSuccess(portfolio -> ErrorResponses.sendJson(context, 201,
                        ApiResponse.success("Portfolio ready", PortfolioResponse.balances(portfolio))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }

    public void value(RoutingContext context) {
        String userId = context.pathParam("userId");
        String base = context.request().getParam("base");

        portfolioUseCase.getPortfolioValue(userId, base)
                .onSuccess(valuation -> ErrorResponses.sendJson(context, 200,
                        ApiResponse.success(PortfolioResponse.valuation(valuation))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }

    public void deposit(RoutingContext context) {
        String userId = context.pathParam("userId");
        AmountRequest request = AmountRequests.parse(context);
        if (request == null) {
            return;
        }

        portfolioUseCase.deposit(userId, request.currency(), request.amount())
                .onSuccess(portfolio -> ErrorResponses.sendJson(context, 200,
                        ApiResponse.success("Deposit accepted", PortfolioResponse.balances(portfolio))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }

    public void trades(RoutingContext context) {
        String userId = context.pathParam("userId");

        tradeUseCase.tradeHistory(userId)
                .onSuccess(trades -> ErrorResponses.sendJson(context, 200, ApiResponse.success(
                        trades.stream().map(TradeReceiptResponse::from).collect(Collectors.toList()))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }
}
