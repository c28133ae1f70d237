package net.otelkafka;

import net.otelkafka.Kafka.Tracing.ConsumerRecordHeadersGetter;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsumerRecordHeadersGetterTest {

    private final ConsumerRecordHeadersGetter getter = ConsumerRecordHeadersGetter.INSTANCE;

    @Test
    void testReadsLastHeaderValueAsUtf8() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 0);
        record.headers().add("traceparent", "old".getBytes(StandardCharsets.UTF_8));
        record.headers().add("traceparent", "new".getBytes(StandardCharsets.UTF_8));

        assertEquals("new", getter.get(record, "traceparent"));
    }

    @Test
    void testListsAllHeaderKeys() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 0);
        record.headers().add("traceparent", new byte[0]);
        record.headers().add("tracestate", new byte[0]);

        List<String> keys = new ArrayList<>();
        getter.keys(record).forEach(keys::add);

        assertEquals(List.of("traceparent", "tracestate"), keys);
    }

    @Test
    void testMissingHeaderIsNull() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 0);

        assertNull(getter.get(record, "traceparent"));
    }

    @Test
    void testNullHeaderValueIsNull() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 0);
        record.headers().add("traceparent", null);

        assertNull(getter.get(record, "traceparent"));
    }

    @Test
    void testNullCarrierIsTolerated() {
        assertNull(getter.get(null, "traceparent"));
        assertFalse(getter.keys(null).iterator().hasNext());
    }
}
