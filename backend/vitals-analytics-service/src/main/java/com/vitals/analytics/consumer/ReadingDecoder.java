package com.vitals.analytics.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vitals.analytics.model.MetricType;
import com.vitals.analytics.model.Reading;
import com.vitals.analytics.model.Timestamps;
import java.io.IOException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Turns a UTF-8 JSON bus payload into a typed {@link Reading}.
 *
 * <p>Expected shape:
 * <pre>{"patient_id": "uuid", "timestamp": "ISO-8601", "heart_rate": 72, "spo2": 98.5, ...}</pre>
 * Fields that are not a known metric (e.g. {@code weight_kg}) are ignored. A missing
 * {@code timestamp} falls back to the time of receipt.
 */
@Component
public class ReadingDecoder {

    static final String PATIENT_ID = "patient_id";
    static final String TIMESTAMP = "timestamp";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReadingDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Reading decode(byte[] payload) throws ReadingDecodeException {
        if (payload == null || payload.length == 0) {
            throw new ReadingDecodeException("empty payload");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new ReadingDecodeException("payload is not valid UTF-8 JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ReadingDecodeException("payload is not a JSON object");
        }

        UUID patientId = patientId(node.get(PATIENT_ID));
        Instant timestamp = timestamp(node.get(TIMESTAMP));

        Map<MetricType, Double> values = new EnumMap<>(MetricType.class);
        for (MetricType metric : MetricType.values()) {
            JsonNode v = node.get(metric.wireName());
            if (v == null || v.isNull()) continue;
            if (!v.isNumber()) {
                throw new ReadingDecodeException(
                        "metric '" + metric.wireName() + "' is not numeric: " + v);
            }
            values.put(metric, v.doubleValue());
        }

        return new Reading(patientId, timestamp, values);
    }

    private static UUID patientId(JsonNode raw) throws ReadingDecodeException {
        if (raw == null || raw.isNull() || raw.asText().isBlank()) {
            throw new ReadingDecodeException("missing " + PATIENT_ID);
        }
        try {
            return UUID.fromString(raw.asText().trim());
        } catch (IllegalArgumentException e) {
            throw new ReadingDecodeException("invalid " + PATIENT_ID + ": " + raw.asText(), e);
        }
    }

    private Instant timestamp(JsonNode raw) throws ReadingDecodeException {
        if (raw == null || raw.isNull()) {
            return clock.instant();
        }
        if (!raw.isTextual()) {
            throw new ReadingDecodeException("invalid " + TIMESTAMP + ": " + raw);
        }
        try {
            return Timestamps.parse(raw.asText());
        } catch (DateTimeException e) {
            throw new ReadingDecodeException("invalid " + TIMESTAMP + ": " + raw.asText(), e);
        }
    }
}
