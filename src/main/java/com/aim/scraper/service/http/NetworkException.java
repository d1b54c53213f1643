package com.aim.scraper.service.http;

import java.util.OptionalInt;

/**
 * Transport-level failure talking to the model page: timeout, connection
 * failure or a non-2xx response. Never retried internally.
 */
public class NetworkException extends RuntimeException {

    private final Integer status;

    public NetworkException(final String message, final Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public NetworkException(final String message, final int status, final Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return HTTP status of the failed exchange, empty when no response arrived
     */
    public OptionalInt status() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }
}
