package com.vth.adapter.in.web.rates;

import com.vth.adapter.in.web.ErrorResponses;
import com.vth.adapter.in.web.dto.ApiResponse;
import com.vth.application.port.in.RateRefreshUseCase;
import com.vth.domain.model.Currency;
import com.vth.domain.model.RateTable;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * HTTP handlers for the rate endpoints
 * POST /api/rates/refresh, GET /api/rates, GET /api/rates/history, GET /api/rates/convert
 */
@Slf4j
@RequiredArgsConstructor
public class RateHandler {

    private final RateRefreshUseCase rateUseCase;
    private final Duration maxRateAge;
    private final Clock clock;

    public void refresh(RoutingContext context) {
        log.info("Manual rate refresh requested");
        rateUseCase.refreshRates()
                .onSuccess(table -> ErrorResponses.sendJson(context, 200,
                        ApiResponse.success("Rates refreshed", toResponse(table))))
                .onFailure(error -> ErrorResponses.sendFailure(context, error));
    }

    public void current(RoutingContext context) {
        ErrorResponses.sendJson(context, 200, ApiResponse.success(toResponse(rateUseCase.currentRates())));
    }

    public void history(RoutingContext context) {
        List<RateTableResponse> history = rateUseCase.rateHistory().stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        ErrorResponses.sendJson(context, 200, ApiResponse.success(history));
    }

    public void convert(RoutingContext context) {
        String from = context.request().getParam("from");
        String to = context.request().getParam("to");
        String amountParam = context.request().getParam("amount", "1");

        if (from == null || to == null) {
            ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Query parameters 'from' and 'to' are required");
            return;
        }

        try {
            BigDecimal amount = new BigDecimal(amountParam);
            BigDecimal converted = rateUseCase.convert(amount, from, to);
            JsonObject result = new JsonObject()
                    .put("from", Currency.fromValue(from).getCode())
                    .put("to", Currency.fromValue(to).getCode())
                    .put("amount", amount.toPlainString())
                    .put("result", converted.toPlainString())
                    .put("rateTableVersion", rateUseCase.currentRates().getVersion());
            ErrorResponses.sendJson(context, 200, ApiResponse.success(result.getMap()));
        } catch (NumberFormatException e) {
            ErrorResponses.sendError(context, 400, "BAD_REQUEST", "Invalid amount: " + amountParam);
        } catch (RuntimeException e) {
            ErrorResponses.sendFailure(context, e);
        }
    }

    private RateTableResponse toResponse(RateTable table) {
        return RateTableResponse.from(table, table.isStale(maxRateAge, clock.instant()));
    }
}
