package com.vth.adapter.out.http;

import com.vth.domain.exception.FetchException;
import com.vth.domain.model.Currency;
import com.vth.domain.model.RateProvider;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;

import java.math.BigDecimal;
import java.util.concurrent.TimeoutException;

/**
 * Response checks and error translation shared by the HTTP rate sources
 */
final class HttpSourceSupport {

    static final int TOO_MANY_REQUESTS = 429;

    private HttpSourceSupport() {
    }

    /**
     * Map a transport failure to a {@link FetchException}
     */
    static FetchException translate(RateProvider provider, Throwable error) {
        if (error instanceof FetchException) {
            return (FetchException) error;
        }
        if (error instanceof TimeoutException) {
            return FetchException.timeout(provider, error.getMessage(), error);
        }
        return FetchException.badResponse(provider, "request failed: " + error.getMessage(), error);
    }

    /**
     * Status check and JSON decoding of a provider response
     */
    static JsonObject jsonBody(RateProvider provider, HttpResponse<Buffer> response) {
        int status = response.statusCode();
        if (status == TOO_MANY_REQUESTS) {
            throw FetchException.rateLimited(provider, "HTTP 429 Too Many Requests");
        }
        if (status < 200 || status >= 300) {
            throw FetchException.badResponse(provider, "HTTP " + status);
        }
        try {
            JsonObject body = response.bodyAsJsonObject();
            if (body == null) {
                throw FetchException.badResponse(provider, "empty response body");
            }
            return body;
        } catch (DecodeException | ClassCastException e) {
            throw FetchException.badResponse(provider, "response is not a JSON object", e);
        }
    }

    /**
     * Quote value as a positive decimal
     */
    static BigDecimal positiveQuote(RateProvider provider, Currency currency, Object value) {
        if (!(value instanceof Number)) {
            throw FetchException.badResponse(provider, "quote for " + currency + " is not numeric: " + value);
        }
        BigDecimal quote = new BigDecimal(value.toString());
        if (quote.signum() <= 0) {
            throw FetchException.badResponse(provider, "quote for " + currency + " is not positive: " + quote);
        }
        return quote;
    }
}
