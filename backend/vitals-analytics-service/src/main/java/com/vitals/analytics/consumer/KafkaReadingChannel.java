package com.vitals.analytics.consumer;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Kafka topic as the reading bus. Offsets are never committed and the consumer starts
 * at the latest offset, which keeps the same no-replay behaviour as Redis pub/sub.
 */
@Component
@Profile("kafka")
public class KafkaReadingChannel implements ReadingChannel {

    private static final Logger log = LoggerFactory.getLogger(KafkaReadingChannel.class);

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final String topicName;
    private final String groupId;
    private final Deque<ConsumerRecord<String, byte[]>> pending = new ArrayDeque<>();

    private Consumer<String, byte[]> consumer;

    public KafkaReadingChannel(ConsumerFactory<String, byte[]> consumerFactory,
                               @Value("${vitals.bus.channel:vital_signs_channel}") String topicName,
                               @Value("${spring.kafka.consumer.group-id:vitals-analytics}") String groupId) {
        this.consumerFactory = consumerFactory;
        this.topicName = topicName;
        this.groupId = groupId;
    }

    @Override
    public String name() {
        return topicName;
    }

    @Override
    public void open() {
        consumer = consumerFactory.createConsumer(groupId, null);
        consumer.subscribe(List.of(topicName));
        log.info("Subscribed to Kafka topic '{}' as group '{}'", topicName, groupId);
    }

    @Override
    public byte[] poll(Duration timeout) {
        if (pending.isEmpty()) {
            ConsumerRecords<String, byte[]> records = consumer.poll(timeout);
            if (records.isEmpty()) return null;
            records.forEach(pending::addLast);
            log.debug("Fetched {} record(s) from '{}'", records.count(), topicName);
        }
        ConsumerRecord<String, byte[]> next = pending.pollFirst();
        return next == null ? null : next.value();
    }

    @Override
    public void close() {
        pending.clear();
        if (consumer != null) {
            consumer.close(Duration.ofSeconds(2));
            consumer = null;
            log.info("Closed Kafka consumer for '{}'", topicName);
        }
    }
}
