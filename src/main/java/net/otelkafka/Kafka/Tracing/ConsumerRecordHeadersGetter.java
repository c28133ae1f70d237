package net.otelkafka.Kafka.Tracing;

import io.opentelemetry.context.propagation.TextMapGetter;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.lang.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads trace context out of Kafka record headers.
 *
 * Missing records, headers or header values read as absent so extraction never fails.
 */
public final class ConsumerRecordHeadersGetter implements TextMapGetter<ConsumerRecord<?, ?>> {

    public static final ConsumerRecordHeadersGetter INSTANCE = new ConsumerRecordHeadersGetter();

    private ConsumerRecordHeadersGetter() {
    }

    @Override
    public Iterable<String> keys(@Nullable ConsumerRecord<?, ?> carrier) {
        Headers headers = headersOf(carrier);
        if (headers == null) {
            return Collections.emptyList();
        }
        List<String> keys = new ArrayList<>();
        for (Header header : headers) {
            keys.add(header.key());
        }
        return keys;
    }

    @Override
    @Nullable
    public String get(@Nullable ConsumerRecord<?, ?> carrier, String key) {
        Headers headers = headersOf(carrier);
        if (headers == null) {
            return null;
        }
        Header header = headers.lastHeader(key);
        if (header == null || header.value() == null) {
            return null;
        }
        return new String(header.value(), StandardCharsets.UTF_8);
    }

    @Nullable
    private static Headers headersOf(@Nullable ConsumerRecord<?, ?> carrier) {
        return carrier != null ? carrier.headers() : null;
    }
}
