package com.vth.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Failure of a whole rate refresh. The individual source failures are attached as suppressed exceptions.
 */
@Getter
public class RefreshException extends ValutaTradeException {

    public enum Kind {
        ALL_SOURCES_FAILED
    }

    private final Kind kind;

    private RefreshException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static RefreshException allSourcesFailed(List<? extends Throwable> causes) {
        RefreshException exception = new RefreshException(
                Kind.ALL_SOURCES_FAILED,
                "All " + causes.size() + " rate sources failed, keeping the previous rate table"
        );
        causes.forEach(exception::addSuppressed);
        return exception;
    }
}
