package com.vitals.analytics.consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.ConsumerFactory;

class KafkaReadingChannelTest {

    private static final String TOPIC = "vital_signs_channel";
    private static final String GROUP = "vitals-analytics";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);
    private static final Duration TIMEOUT = Duration.ofMillis(10);

    private final MockConsumer<String, byte[]> first = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    private final MockConsumer<String, byte[]> second = new MockConsumer<>(OffsetResetStrategy.EARLIEST);

    @SuppressWarnings("unchecked")
    private final ConsumerFactory<String, byte[]> factory = mock(ConsumerFactory.class);

    private final KafkaReadingChannel channel = new KafkaReadingChannel(factory, TOPIC, GROUP);

    KafkaReadingChannelTest() {
        when(factory.createConsumer(GROUP, null)).thenReturn(first, second);
    }

    private static void assign(MockConsumer<String, byte[]> consumer) {
        consumer.rebalance(List.of(PARTITION));
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
    }

    private static void publish(MockConsumer<String, byte[]> consumer, long offset, String value) {
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, offset, null, value.getBytes(StandardCharsets.UTF_8)));
    }

    private String next() {
        byte[] payload = channel.poll(TIMEOUT);
        return payload == null ? null : new String(payload, StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should subscribe to the configured topic on open")
    void shouldSubscribeOnOpen() {
        channel.open();

        assertThat(channel.name()).isEqualTo(TOPIC);
        assertThat(first.subscription()).containsExactly(TOPIC);
        verify(factory, times(1)).createConsumer(GROUP, null);
    }

    @Test
    @DisplayName("Should return null when a poll brings nothing")
    void shouldReturnNullOnEmptyPoll() {
        channel.open();
        assign(first);

        assertThat(channel.poll(TIMEOUT)).isNull();
    }

    @Test
    @DisplayName("Should hand out a fetched batch one record at a time before fetching again")
    void shouldServeBatchBeforeNextFetch() {
        channel.open();
        assign(first);
        publish(first, 0, "a");
        publish(first, 1, "b");
        publish(first, 2, "c");

        assertThat(next()).isEqualTo("a");

        // lands in the consumer, behind what is already buffered
        publish(first, 3, "d");

        assertThat(next()).isEqualTo("b");
        assertThat(next()).isEqualTo("c");
        assertThat(next()).isEqualTo("d");
        assertThat(next()).isNull();
    }

    @Test
    @DisplayName("Should drop buffered records and close the consumer on close")
    void shouldClearBufferOnClose() {
        channel.open();
        assign(first);
        publish(first, 0, "a");
        publish(first, 1, "b");
        assertThat(next()).isEqualTo("a");

        channel.close();

        assertThat(first.closed()).isTrue();

        channel.open();
        assign(second);

        assertThat(channel.poll(TIMEOUT)).isNull();
        verify(factory, times(2)).createConsumer(GROUP, null);
    }

    @Test
    @DisplayName("Should tolerate close before open")
    void shouldTolerateCloseBeforeOpen() {
        channel.close();

        assertThat(first.closed()).isFalse();
    }
}
