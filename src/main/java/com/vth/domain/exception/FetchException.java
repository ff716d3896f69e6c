package com.vth.domain.exception;

import com.vth.domain.model.RateProvider;
import lombok.Getter;

/**
 * Failure of a single external rate source.
 * Never propagates past the rate cache, which isolates it per source.
 */
@Getter
public class FetchException extends ValutaTradeException {

    public enum Kind {
        TIMEOUT,
        BAD_RESPONSE,
        RATE_LIMITED
    }

    private final RateProvider provider;
    private final Kind kind;

    public FetchException(RateProvider provider, Kind kind, String message) {
        super(provider.getValue() + " " + kind + ": " + message);
        this.provider = provider;
        this.kind = kind;
    }

    public FetchException(RateProvider provider, Kind kind, String message, Throwable cause) {
        super(provider.getValue() + " " + kind + ": " + message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public static FetchException timeout(RateProvider provider, String message, Throwable cause) {
        return new FetchException(provider, Kind.TIMEOUT, message, cause);
    }

    public static FetchException badResponse(RateProvider provider, String message) {
        return new FetchException(provider, Kind.BAD_RESPONSE, message);
    }

    public static FetchException badResponse(RateProvider provider, String message, Throwable cause) {
        return new FetchException(provider, Kind.BAD_RESPONSE, message, cause);
    }

    public static FetchException rateLimited(RateProvider provider, String message) {
        return new FetchException(provider, Kind.RATE_LIMITED, message);
    }
}
