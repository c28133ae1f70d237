package net.otelkafka.Kafka.Metrics;

import io.opentelemetry.api.common.Attributes;

/**
 * No-Op implementation of MetricsRecorder.
 * Used when the metrics backend cannot supply instruments.
 */
public class NoOpMetricsRecorder implements MetricsRecorder {

    public static final NoOpMetricsRecorder INSTANCE = new NoOpMetricsRecorder();

    private NoOpMetricsRecorder() {
    }

    @Override
    public void recordReceiveDuration(double seconds, Attributes attributes) {
        // No-Op
    }

    @Override
    public void incrementConsumedMessages(Attributes attributes) {
        // No-Op
    }

    @Override
    public void recordProcessDuration(double seconds, Attributes attributes) {
        // No-Op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
