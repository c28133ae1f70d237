package net.otelkafka.Kafka.Process;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import net.otelkafka.Kafka.Tracing.MessagingAttributes;
import org.springframework.lang.Nullable;

/**
 * Processing of one record, opened by {@link MessageProcessInstrumenter#newProcessOperation}.
 *
 * <p>
 * Owned by the thread processing the record. {@link #stop()} (or {@link #close()}) must be called
 * exactly once; a second call records the duration again.
 * </p>
 */
public class MessageProcessOperation implements AutoCloseable {

    private final MessageProcessInstrumenter instrumenter;
    private final Span span;
    private final String topic;
    private final String partition;
    private final long startNanos;

    @Nullable
    private Throwable error;

    MessageProcessOperation(MessageProcessInstrumenter instrumenter, Span span, String topic, String partition,
                            long startNanos) {
        this.instrumenter = instrumenter;
        this.span = span;
        this.topic = topic;
        this.partition = partition;
        this.startNanos = startNanos;
    }

    /**
     * Marks the processing as failed. The last error set before {@link #stop()} wins.
     */
    public void setError(@Nullable Throwable error) {
        this.error = error;
    }

    /**
     * Ends the span and records the process duration.
     */
    public void stop() {
        span.end();

        // no message id on metrics
        Attributes attributes = MessagingAttributes.withDestination(instrumenter.getDefaultAttributes(), topic, partition);
        if (error != null) {
            attributes = attributes.toBuilder()
                .put(MessagingAttributes.ERROR_TYPE, describe(error))
                .build();
        }

        double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        instrumenter.getMetricsRecorder().recordProcessDuration(seconds, attributes);
    }

    /**
     * Same as {@link #stop()}.
     */
    @Override
    public void close() {
        stop();
    }

    public Span getSpan() {
        return span;
    }

    public String getTopic() {
        return topic;
    }

    public String getPartition() {
        return partition;
    }

    @Nullable
    public Throwable getError() {
        return error;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null ? message : error.getClass().getName();
    }
}
