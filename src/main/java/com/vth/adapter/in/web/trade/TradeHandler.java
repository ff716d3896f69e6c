package com.vth.adapter.in.web.trade;

import com.vth.adapter.in.web.ErrorResponses;
import com.vth.adapter.in.web.dto.AmountRequest;
import com.vth.adapter.in.web.dto.ApiResponse;
import com.vth.adapter.in.web.portfolio.AmountRequests;
import com.vth.application.port.in.TradeUseCase;
import com.vth.domain.model.TradeDirection;
import com.vth.domain.model.TradeReceipt;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for POST /api/portfolios/{userId}/buy and /sell
 */
@Slf4j
public class TradeHandler implements Handler<RoutingContext> {

    private final TradeUseCase tradeUseCase;
    private final TradeDirection direction;

    public TradeHandler(TradeUseCase tradeUseCase, TradeDirection direction) {
        this.tradeUseCase = tradeUseCase;
        this.direction = direction;
    }

    @Override
    public void handle(RoutingContext context) {
        String userId = context.pathParam("userId");
        AmountRequest request = AmountRequests.parse(context);
        if (request == null) {
            return;
        }
        log.info("Received {} request from user {}: {} {}", direction.getValue(), userId, request.amount(), request.currency());

        Future<TradeReceipt> result = direction == TradeDirection.BUY
                ? tradeUseCase.buy(userId, request.currency(), request.amount())
                : tradeUseCase.sell(userId, request.currency(), request.amount());

        result.onSuccess(receipt -> ErrorResponses.sendJson(context, 201,
                        ApiResponse.success("Trade executed", TradeReceiptResponse.from(receipt))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }
}
