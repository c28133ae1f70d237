package net.otelkafka.Kafka.Process;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;
import net.otelkafka.Kafka.Metrics.MetricsRecorder;
import net.otelkafka.Kafka.Metrics.MetricsRecorders;
import net.otelkafka.Kafka.Tracing.ConsumerSpans;
import net.otelkafka.Kafka.Tracing.MessagingAttributes;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brackets the processing of a single record with a {@code "<topic> process"} span and a
 * process-duration measurement.
 *
 * <pre>
 * MessageProcessOperation operation = instrumenter.newProcessOperation(record);
 * try {
 *     handle(record);
 * } catch (Exception e) {
 *     operation.setError(e);
 *     throw e;
 * } finally {
 *     operation.stop();
 * }
 * </pre>
 *
 * Thread-safe; the operations it hands out are not.
 */
public class MessageProcessInstrumenter {

    private static final Logger logger = LoggerFactory.getLogger(MessageProcessInstrumenter.class);

    private final ConsumerSpans spans;
    private final MetricsRecorder metricsRecorder;
    private final Attributes defaultAttributes;

    public MessageProcessInstrumenter(KafkaTelemetryConfig config) {
        this(config, MetricsRecorders.create(config));
    }

    public MessageProcessInstrumenter(KafkaTelemetryConfig config, MetricsRecorder metricsRecorder) {
        this.spans = new ConsumerSpans(config);
        this.metricsRecorder = metricsRecorder;
        this.defaultAttributes = MessagingAttributes.defaultAttributes(config, MessagingAttributes.PROCESS);
        logger.debug("message process instrumenter created for {}", config);
    }

    /**
     * Starts a process span for {@code record}. The returned operation must be stopped exactly once.
     */
    public MessageProcessOperation newProcessOperation(ConsumerRecord<?, ?> record) {
        String partition = Integer.toString(record.partition());
        Attributes spanAttributes = MessagingAttributes.withMessageId(
            MessagingAttributes.withDestination(defaultAttributes, record.topic(), partition),
            record.offset());

        Span span = spans.start(record, MessagingAttributes.PROCESS, SpanKind.CONSUMER, spanAttributes);
        return new MessageProcessOperation(this, span, record.topic(), partition, System.nanoTime());
    }

    /**
     * Runs {@code processor} inside a process operation. A thrown exception is recorded as the
     * operation's error and rethrown unchanged.
     */
    public <K, V> void process(ConsumerRecord<K, V> record, RecordProcessor<K, V> processor) throws Exception {
        MessageProcessOperation operation = newProcessOperation(record);
        try {
            processor.process(record);
        } catch (Exception e) {
            operation.setError(e);
            throw e;
        } finally {
            operation.stop();
        }
    }

    Attributes getDefaultAttributes() {
        return defaultAttributes;
    }

    MetricsRecorder getMetricsRecorder() {
        return metricsRecorder;
    }
}
