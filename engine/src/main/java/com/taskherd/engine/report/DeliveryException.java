package com.taskherd.engine.report;

/**
 * Posting to the external host failed.
 *
 * {@code retryable} is true for network errors, rate limiting and 5xx
 * responses; anything else (bad credentials, unknown target) will not get
 * better by trying again.
 */
public class DeliveryException extends RuntimeException {

    private final boolean retryable;

    public DeliveryException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public DeliveryException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
