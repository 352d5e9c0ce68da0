package com.taskherd.engine.webhook;

/**
 * Webhook signature missing, malformed or wrong.
 *
 * The message is for logs only; callers answer with a generic
 * authentication failure whatever the reason.
 */
public class SignatureVerificationException extends RuntimeException {
    public SignatureVerificationException(String message) {
        super(message);
    }
}
