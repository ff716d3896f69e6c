package com.vth.adapter.in.web;

import com.vth.adapter.in.web.dto.ApiResponse;
import com.vth.domain.exception.ConversionException;
import com.vth.domain.exception.PortfolioNotFoundException;
import com.vth.domain.exception.RefreshException;
import com.vth.domain.exception.TradeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes JSON responses and maps domain failures to HTTP status codes
 */
@Slf4j
public final class ErrorResponses {

    private ErrorResponses() {
    }

    public static void sendJson(RoutingContext context, int statusCode, ApiResponse response) {
        context.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(JsonObject.mapFrom(response).encode());
    }

    public static void sendError(RoutingContext context, int statusCode, String errorCode, String message) {
        sendJson(context, statusCode, ApiResponse.error(errorCode, message));
    }

    public static void sendFailure(RoutingContext context, Throwable error) {
        int statusCode = statusOf(error);
        if (statusCode >= 500) {
            log.error("Request {} {} failed: {}", context.request().method(), context.request().path(), error.getMessage(), error);
        } else {
            log.info("Request {} {} rejected ({}): {}", context.request().method(), context.request().path(), statusCode, error.getMessage());
        }
        sendJson(context, statusCode, ApiResponse.error(errorCodeOf(error), error.getMessage(), detailsOf(error)));
    }

    static int statusOf(Throwable error) {
        if (error instanceof TradeException) {
            switch (((TradeException) error).getKind()) {
                case INSUFFICIENT_FUNDS:
                case STALE_RATES:
                    return 409;
                default:
                    return 400;
            }
        }
        if (error instanceof ConversionException || error instanceof IllegalArgumentException) {
            return 400;
        }
        if (error instanceof PortfolioNotFoundException) {
            return 404;
        }
        if (error instanceof RefreshException) {
            return 503;
        }
        return 500;
    }

    static String errorCodeOf(Throwable error) {
        if (error instanceof TradeException) {
            return ((TradeException) error).getKind().name();
        }
        if (error instanceof ConversionException) {
            return ((ConversionException) error).getKind().name();
        }
        if (error instanceof RefreshException) {
            return ((RefreshException) error).getKind().name();
        }
        if (error instanceof PortfolioNotFoundException) {
            return "PORTFOLIO_NOT_FOUND";
        }
        if (error instanceof IllegalArgumentException) {
            return "BAD_REQUEST";
        }
        return "INTERNAL_ERROR";
    }

    private static Map<String, String> detailsOf(Throwable error) {
        if (!(error instanceof TradeException)) {
            return null;
        }
        TradeException trade = (TradeException) error;
        if (trade.getKind() != TradeException.Kind.INSUFFICIENT_FUNDS) {
            return null;
        }
        Map<String, String> details = new LinkedHashMap<>();
        details.put("currency", trade.getCurrency().getCode());
        details.put("available", trade.getAvailable().toPlainString());
        details.put("required", trade.getRequired().toPlainString());
        return details;
    }
}
