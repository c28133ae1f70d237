package net.otelkafka.Kafka.Metrics;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry-based implementation of MetricsRecorder.
 *
 * All three instruments are created up front; the constructor throws if the meter cannot supply them.
 */
public class OpenTelemetryMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryMetricsRecorder.class);

    private final DoubleHistogram receiveDuration;
    private final LongCounter consumedMessages;
    private final DoubleHistogram processDuration;

    public OpenTelemetryMetricsRecorder(Meter meter) {
        this.receiveDuration = meter.histogramBuilder(OPERATION_DURATION)
            .setDescription("Duration of receiving a message and handing it to the consumer")
            .setUnit("s")
            .build();
        this.consumedMessages = meter.counterBuilder(CONSUMED_MESSAGES)
            .setDescription("Number of messages delivered to the consumer")
            .setUnit("{message}")
            .build();
        this.processDuration = meter.histogramBuilder(PROCESS_DURATION)
            .setDescription("Duration of processing a message")
            .setUnit("s")
            .build();
    }

    @Override
    public void recordReceiveDuration(double seconds, Attributes attributes) {
        try {
            receiveDuration.record(seconds, attributes);
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", OPERATION_DURATION, e.getMessage());
        }
    }

    @Override
    public void incrementConsumedMessages(Attributes attributes) {
        try {
            consumedMessages.add(1, attributes);
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", CONSUMED_MESSAGES, e.getMessage());
        }
    }

    @Override
    public void recordProcessDuration(double seconds, Attributes attributes) {
        try {
            processDuration.record(seconds, attributes);
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", PROCESS_DURATION, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
