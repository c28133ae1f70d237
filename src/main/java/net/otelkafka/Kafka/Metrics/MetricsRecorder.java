package net.otelkafka.Kafka.Metrics;

import io.opentelemetry.api.common.Attributes;

/**
 * Interface responsible for recording consumer metrics.
 * Decouples the instrumentation from a specific metrics backend.
 */
public interface MetricsRecorder {

    String OPERATION_DURATION = "messaging.client.operation.duration";
    String CONSUMED_MESSAGES = "messaging.client.consumed.messages";
    String PROCESS_DURATION = "messaging.client.process.duration";

    /**
     * Records how long a record took to be received and handed downstream.
     *
     * @param seconds    elapsed time in seconds
     * @param attributes default attributes plus destination and partition
     */
    void recordReceiveDuration(double seconds, Attributes attributes);

    /**
     * Counts one consumed record.
     *
     * @param attributes default attributes plus destination and partition
     */
    void incrementConsumedMessages(Attributes attributes);

    /**
     * Records how long the caller spent processing a record.
     *
     * @param seconds    elapsed time in seconds
     * @param attributes default attributes plus destination, partition and optional error type
     */
    void recordProcessDuration(double seconds, Attributes attributes);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if a real backend is behind this recorder
     */
    boolean isAvailable();
}
