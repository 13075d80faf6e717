package com.vitals.analytics.consumer;

/**
 * A bus message that cannot be turned into a {@link com.vitals.analytics.model.Reading}.
 * Always scoped to one message; the consumer drops it and moves on.
 */
public class ReadingDecodeException extends Exception {

    public ReadingDecodeException(String message) {
        super(message);
    }

    public ReadingDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
