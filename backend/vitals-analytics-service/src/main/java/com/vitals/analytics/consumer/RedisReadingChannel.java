package com.vitals.analytics.consumer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Redis pub/sub subscription. The listener container pushes messages on its own
 * threads; they are handed to the consumer loop through a bounded buffer so that
 * decoding and evaluation always run on the consumer thread.
 */
@Component
@Profile("!kafka")
public class RedisReadingChannel implements ReadingChannel, MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisReadingChannel.class);

    private final RedisMessageListenerContainer container;
    private final ChannelTopic topic;
    private final BlockingQueue<byte[]> buffer;
    private final Counter overflowDropped;

    public RedisReadingChannel(RedisMessageListenerContainer container,
                               MeterRegistry meterRegistry,
                               @Value("${vitals.bus.channel:vital_signs_channel}") String channel,
                               @Value("${vitals.bus.buffer-capacity:10000}") int bufferCapacity) {
        this.container = container;
        this.topic = new ChannelTopic(channel);
        this.buffer = new LinkedBlockingQueue<>(bufferCapacity);
        this.overflowDropped = meterRegistry.counter("vitals_stream_messages_dropped_total", "reason", "buffer_full");
    }

    @Override
    public String name() {
        return topic.getTopic();
    }

    @Override
    public void open() {
        container.addMessageListener(this, topic);
        log.info("Subscribed to Redis channel '{}'", topic.getTopic());
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        byte[] body = message.getBody();
        if (body == null) return;
        if (!buffer.offer(body)) {
            overflowDropped.increment();
            log.warn("Reading buffer full ({} messages); dropping message from '{}'",
                    buffer.size(), topic.getTopic());
        }
    }

    @Override
    public byte[] poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        container.removeMessageListener(this, topic);
        int pending = buffer.size();
        buffer.clear();
        if (pending > 0) {
            log.warn("Unsubscribed from '{}' with {} unprocessed message(s) discarded", topic.getTopic(), pending);
        } else {
            log.info("Unsubscribed from Redis channel '{}'", topic.getTopic());
        }
    }
}
