package com.vitals.analytics.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

class RedisReadingChannelTest {

    private final RedisMessageListenerContainer container = mock(RedisMessageListenerContainer.class);
    private final SimpleMeterRegistry metrics = new SimpleMeterRegistry();

    private static DefaultMessage message(String body) {
        return new DefaultMessage("vital_signs_channel".getBytes(StandardCharsets.UTF_8),
                body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should hand pushed messages to poll in arrival order")
    void shouldBufferInOrder() throws Exception {
        RedisReadingChannel channel = new RedisReadingChannel(container, metrics, "vital_signs_channel", 10);
        channel.open();

        channel.onMessage(message("a"), null);
        channel.onMessage(message("b"), null);

        assertThat(new String(channel.poll(Duration.ofMillis(10)), StandardCharsets.UTF_8)).isEqualTo("a");
        assertThat(new String(channel.poll(Duration.ofMillis(10)), StandardCharsets.UTF_8)).isEqualTo("b");
        assertThat(channel.poll(Duration.ofMillis(10))).isNull();
        verify(container).addMessageListener(eq(channel), any(ChannelTopic.class));
    }

    @Test
    @DisplayName("Should drop and count messages once the buffer is full")
    void shouldDropOnOverflow() {
        RedisReadingChannel channel = new RedisReadingChannel(container, metrics, "vital_signs_channel", 1);

        channel.onMessage(message("kept"), null);
        channel.onMessage(message("dropped"), null);

        assertThat(metrics.counter("vitals_stream_messages_dropped_total", "reason", "buffer_full").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should unsubscribe and discard pending messages on close")
    void shouldDiscardOnClose() throws Exception {
        RedisReadingChannel channel = new RedisReadingChannel(container, metrics, "vital_signs_channel", 10);
        channel.open();
        channel.onMessage(message("late"), null);

        channel.close();

        verify(container).removeMessageListener(eq(channel), any(ChannelTopic.class));
        assertThat(channel.poll(Duration.ofMillis(10))).isNull();
        assertThat(channel.name()).isEqualTo("vital_signs_channel");
    }
}
