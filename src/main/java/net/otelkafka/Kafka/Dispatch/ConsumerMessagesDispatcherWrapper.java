package net.otelkafka.Kafka.Dispatch;

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

import java.io.Closeable;

/**
 * Re-emits the records of another dispatcher while tracing and measuring each receive.
 *
 * <p>
 * {@link #run()} drains the wrapped dispatcher's channel. For every record it starts a
 * {@code "<topic> receive"} span, hands the record to {@link #messages()}, ends the span once the
 * record has been taken, then records receive duration and the consumed-message count. Records are
 * forwarded unchanged and in order. The output channel is closed after the last record when the
 * input channel closes, or straight away by {@link #close()}.
 * </p>
 *
 * <p>
 * Run exactly one thread per wrapper; it is the only reader of the wrapped channel and the only
 * writer of the output channel.
 * </p>
 */
public class ConsumerMessagesDispatcherWrapper<K, V> implements ConsumerMessagesDispatcher<K, V>, Runnable, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ConsumerMessagesDispatcherWrapper.class);

    private final ConsumerMessagesDispatcher<K, V> dispatcher;
    private final MessageChannel<ConsumerRecord<K, V>> messages = new MessageChannel<>();

    private final ConsumerSpans spans;
    private final MetricsRecorder metricsRecorder;
    private final Attributes defaultAttributes;

    public ConsumerMessagesDispatcherWrapper(ConsumerMessagesDispatcher<K, V> dispatcher, KafkaTelemetryConfig config) {
        this(dispatcher, config, MetricsRecorders.create(config));
    }

    public ConsumerMessagesDispatcherWrapper(ConsumerMessagesDispatcher<K, V> dispatcher,
                                             KafkaTelemetryConfig config,
                                             MetricsRecorder metricsRecorder) {
        this.dispatcher = dispatcher;
        this.spans = new ConsumerSpans(config);
        this.metricsRecorder = metricsRecorder;
        this.defaultAttributes = MessagingAttributes.defaultAttributes(config, MessagingAttributes.RECEIVE);
    }

    /**
     * Returns the channel for the records that are returned by the broker.
     */
    @Override
    public MessageChannel<ConsumerRecord<K, V>> messages() {
        return messages;
    }

    @Override
    public void run() {
        MessageChannel<ConsumerRecord<K, V>> source = dispatcher.messages();
        long forwarded = 0;
        try {
            ConsumerRecord<K, V> record;
            while ((record = source.receive()) != null) {
                dispatch(record);
                forwarded++;
            }
            logger.debug("upstream closed after {} records, closing wrapped channel", forwarded);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted after forwarding {} records, closing wrapped channel", forwarded);
        } catch (IllegalStateException e) {
            logger.debug("wrapped channel closed after forwarding {} records", forwarded);
        } finally {
            messages.close();
        }
    }

    /**
     * Closes the output channel. A record still waiting for a reader is dropped without receive
     * metrics and {@link #run()} returns; the wrapped dispatcher is not touched.
     */
    @Override
    public void close() {
        messages.close();
    }

    private void dispatch(ConsumerRecord<K, V> record) throws InterruptedException {
        long start = System.nanoTime();

        // metrics leave out the offset
        Attributes attributes = MessagingAttributes.withDestination(defaultAttributes, record.topic(), record.partition());
        Span span = spans.start(record, MessagingAttributes.RECEIVE, SpanKind.INTERNAL,
            MessagingAttributes.withMessageId(attributes, record.offset()));

        try {
            messages.send(record);
        } finally {
            span.end();
        }

        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        metricsRecorder.recordReceiveDuration(seconds, attributes);
        metricsRecorder.incrementConsumedMessages(attributes);
    }
}
