package net.otelkafka.Kafka.Metrics;

import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the metrics backend for a configuration.
 */
public final class MetricsRecorders {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRecorders.class);

    private MetricsRecorders() {
    }

    /**
     * Micrometer when a registry is configured, otherwise the OpenTelemetry meter.
     * Falls back to {@link NoOpMetricsRecorder} if instruments cannot be created; never throws.
     */
    public static MetricsRecorder create(KafkaTelemetryConfig config) {
        try {
            if (config.getMeterRegistry() != null) {
                return new MicrometerMetricsRecorder(config.getMeterRegistry());
            }
            return new OpenTelemetryMetricsRecorder(config.getMeter());
        } catch (Exception e) {
            logger.warn("kafka consumer metrics disabled - could not create instruments: {}", e.getMessage());
            return NoOpMetricsRecorder.INSTANCE;
        }
    }
}
