package com.vth.domain.exception;

/**
 * Base of all business errors raised by the rate cache and the trade engine
 */
public abstract class ValutaTradeException extends RuntimeException {

    protected ValutaTradeException(String message) {
        super(message);
    }

    protected ValutaTradeException(String message, Throwable cause) {
        super(message, cause);
    }
}
