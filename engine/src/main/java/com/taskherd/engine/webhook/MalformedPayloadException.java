package com.taskherd.engine.webhook;

/** A correctly signed webhook body that is not a JSON object. */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
