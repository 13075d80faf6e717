package com.vitals.analytics.consumer;

import java.time.Duration;

/**
 * Subscription to the channel that carries raw readings.
 *
 * <p>All three methods are called from the single consumer thread, in the order
 * {@code open}, {@code poll}..., {@code close}. Delivery is fire-and-forget: messages
 * published while no subscription is open are gone.
 */
public interface ReadingChannel {

    /** Channel or topic name, for logs. */
    String name();

    void open();

    /**
     * Wait up to {@code timeout} for the next message.
     *
     * @return the raw payload, or {@code null} if nothing arrived in time
     */
    byte[] poll(Duration timeout) throws InterruptedException;

    void close();
}
