package net.otelkafka.Kafka.Metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.common.Attributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Micrometer-based implementation of MetricsRecorder.
 *
 * Instrument names match the OpenTelemetry ones. Durations are timers
 * and every attribute becomes a tag.
 */
public class MicrometerMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerMetricsRecorder.class);
    private final MeterRegistry meterRegistry;

    public MicrometerMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordReceiveDuration(double seconds, Attributes attributes) {
        try {
            Timer.builder(OPERATION_DURATION)
                    .tags(toTags(attributes))
                    .register(meterRegistry)
                    .record(toDuration(seconds));
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", OPERATION_DURATION, e.getMessage());
        }
    }

    @Override
    public void incrementConsumedMessages(Attributes attributes) {
        try {
            Counter.builder(CONSUMED_MESSAGES)
                    .baseUnit("messages")
                    .tags(toTags(attributes))
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", CONSUMED_MESSAGES, e.getMessage());
        }
    }

    @Override
    public void recordProcessDuration(double seconds, Attributes attributes) {
        try {
            Timer.builder(PROCESS_DURATION)
                    .tags(toTags(attributes))
                    .register(meterRegistry)
                    .record(toDuration(seconds));
        } catch (Exception e) {
            logger.warn("failed to record {}: {}", PROCESS_DURATION, e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000.0));
    }

    static List<Tag> toTags(Attributes attributes) {
        List<Tag> tags = new ArrayList<>(attributes.size());
        attributes.forEach((key, value) -> tags.add(Tag.of(key.getKey(), String.valueOf(value))));
        return tags;
    }
}
