package com.canvaslink.exception;

import lombok.Getter;

/**
 * Raised when a detector variant cannot be constructed, fails while detecting or matching,
 * or exceeds its per-call deadline.
 */
@Getter
public class DetectorUnavailableException extends RuntimeException {

    private final boolean timeout;

    public DetectorUnavailableException(String message) {
        this(message, null, false);
    }

    public DetectorUnavailableException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public DetectorUnavailableException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static DetectorUnavailableException timedOut(long timeoutMillis) {
        return new DetectorUnavailableException("Matching exceeded deadline of " + timeoutMillis + " ms", null, true);
    }
}
