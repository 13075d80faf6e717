package com.vitals.analytics.consumer;

import com.vitals.analytics.service.VitalSignProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Long-lived background subscriber for the reading bus.
 *
 * <p>Runs on its own thread, separate from the request-serving pool. The loop polls
 * with a bounded timeout and checks its {@link CancellationToken} between polls, so a
 * stop is observed within one poll interval. A message that is already being handled
 * is always finished; nothing interrupts an evaluation in progress.
 */
@Component
public class StreamConsumer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StreamConsumer.class);

    private final ReadingChannel channel;
    private final VitalSignProcessor processor;
    private final Duration pollInterval;
    private final Duration shutdownGrace;
    private final boolean autoStart;
    private final Counter messagesConsumed;
    private final Counter messagesFailed;

    private final AtomicReference<ConsumerState> state = new AtomicReference<>(ConsumerState.STOPPED);
    private volatile CancellationToken token;
    private volatile Thread worker;

    public StreamConsumer(ReadingChannel channel,
                          VitalSignProcessor processor,
                          MeterRegistry meterRegistry,
                          @Value("${vitals.bus.poll-interval-ms:1000}") long pollIntervalMs,
                          @Value("${vitals.consumer.shutdown-grace-ms:5000}") long shutdownGraceMs,
                          @Value("${vitals.consumer.enabled:true}") boolean autoStart) {
        this.channel = channel;
        this.processor = processor;
        this.pollInterval = Duration.ofMillis(pollIntervalMs);
        this.shutdownGrace = Duration.ofMillis(shutdownGraceMs);
        this.autoStart = autoStart;
        this.messagesConsumed = meterRegistry.counter("vitals_stream_messages_consumed_total");
        this.messagesFailed = meterRegistry.counter("vitals_stream_messages_failed_total");
    }

    // start and stop share the monitor, so stop always cancels the token of the run it stops
    @Override
    public synchronized void start() {
        if (!state.compareAndSet(ConsumerState.STOPPED, ConsumerState.RUNNING)) {
            log.debug("Consumer start ignored in state {}", state.get());
            return;
        }
        CancellationToken runToken = new CancellationToken();
        token = runToken;
        Thread t = new Thread(() -> runLoop(runToken), "reading-consumer");
        t.setDaemon(true);
        worker = t;
        t.start();
    }

    @Override
    public synchronized void stop() {
        if (!state.compareAndSet(ConsumerState.RUNNING, ConsumerState.STOPPING)) {
            return;
        }
        log.info("Stopping reading consumer on '{}'", channel.name());
        token.cancel();
        Thread t = worker;
        if (t == null || t == Thread.currentThread()) return;
        try {
            t.join(pollInterval.plus(shutdownGrace).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            log.warn("Reading consumer did not finish within {} ms; leaving it to complete in the background",
                    pollInterval.plus(shutdownGrace).toMillis());
        }
    }

    @Override
    public boolean isRunning() {
        return state.get() != ConsumerState.STOPPED;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }

    // start after everything the pipeline needs, stop before it goes away
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    public ConsumerState getState() {
        return state.get();
    }

    void runLoop(CancellationToken runToken) {
        try {
            channel.open();
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to '{}': {}", channel.name(), e.getMessage(), e);
            state.set(ConsumerState.STOPPED);
            return;
        }
        log.info("Reading consumer started: channel='{}' pollInterval={}ms", channel.name(), pollInterval.toMillis());

        try {
            while (!runToken.isCancelled()) {
                byte[] payload;
                try {
                    payload = channel.poll(pollInterval);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (RuntimeException e) {
                    log.warn("Poll on '{}' failed: {}", channel.name(), e.getMessage());
                    if (runToken.await(pollInterval)) break;
                    continue;
                }
                if (payload != null) {
                    handle(payload);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                channel.close();
            } catch (RuntimeException e) {
                log.warn("Error closing channel '{}': {}", channel.name(), e.getMessage());
            }
            state.set(ConsumerState.STOPPED);
            log.info("Reading consumer stopped");
        }
    }

    private void handle(byte[] payload) {
        try {
            processor.handleMessage(payload);
            messagesConsumed.increment();
        } catch (RuntimeException e) {
            messagesFailed.increment();
            log.error("Failed to process reading from '{}': {}", channel.name(), e.getMessage(), e);
        }
    }
}
