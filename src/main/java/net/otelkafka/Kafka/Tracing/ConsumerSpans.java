package net.otelkafka.Kafka.Tracing;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts consumer-side spans for Kafka records.
 *
 * The span context carried in the record headers becomes a link of the new span, not its parent.
 */
public class ConsumerSpans {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerSpans.class);

    private final KafkaTelemetryConfig config;

    public ConsumerSpans(KafkaTelemetryConfig config) {
        this.config = config;
    }

    /**
     * Extracts the producer's trace context from the record headers.
     * Returns the root context when the headers carry nothing usable.
     */
    public Context extractParent(ConsumerRecord<?, ?> record) {
        try {
            return config.getPropagator().extract(Context.root(), record, ConsumerRecordHeadersGetter.INSTANCE);
        } catch (RuntimeException e) {
            logger.debug("failed to extract trace context from record {}-{}@{}: {}",
                record.topic(), record.partition(), record.offset(), e.getMessage());
            return Context.root();
        }
    }

    /**
     * Starts {@code "<topic> <operation>"} linked to the context extracted from {@code record}.
     * Never throws; a no-op span is returned if the tracer fails.
     */
    public Span start(ConsumerRecord<?, ?> record, String operationName, SpanKind kind, Attributes attributes) {
        SpanContext linked = Span.fromContext(extractParent(record)).getSpanContext();
        try {
            SpanBuilder builder = config.getTracer()
                .spanBuilder(record.topic() + " " + operationName)
                .setNoParent()
                .setSpanKind(kind)
                .setAllAttributes(attributes);
            if (linked.isValid()) {
                builder.addLink(linked);
            }
            return builder.startSpan();
        } catch (RuntimeException e) {
            logger.warn("failed to start {} span for topic {}: {}", operationName, record.topic(), e.getMessage());
            return Span.getInvalid();
        }
    }
}
