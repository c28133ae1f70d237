package net.otelkafka.Kafka.Config;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.TracerProvider;
import io.opentelemetry.context.propagation.TextMapPropagator;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Resolved, read-only telemetry configuration shared by every wrapper and instrumenter.
 *
 * Built through {@link Builder}. Providers default to an explicitly passed
 * {@link OpenTelemetry} snapshot; {@link #builder()} takes the snapshot from
 * {@link GlobalOpenTelemetry} at call time.
 */
@Getter
public class KafkaTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(KafkaTelemetryConfig.class);

    public static final String INSTRUMENTATION_NAME = "net.otelkafka.kafka";
    public static final String INSTRUMENTATION_VERSION = "0.1.0";

    private final TracerProvider tracerProvider;
    private final MeterProvider meterProvider;
    private final TextMapPropagator propagator;

    private final Tracer tracer;
    private final Meter meter;

    @Nullable
    private final MeterRegistry meterRegistry;

    @Nullable
    private final String serverAddress;
    // 0 when unset
    private final int serverPort;
    @Nullable
    private final String consumerGroupId;

    KafkaTelemetryConfig(Builder builder) {
        this.tracerProvider = builder.tracerProvider;
        this.meterProvider = builder.meterProvider;
        this.propagator = builder.propagator;
        this.meterRegistry = builder.meterRegistry;
        this.serverAddress = builder.serverAddress;
        this.serverPort = builder.serverPort;
        this.consumerGroupId = builder.consumerGroupId;

        this.tracer = tracerProvider.tracerBuilder(INSTRUMENTATION_NAME)
            .setInstrumentationVersion(INSTRUMENTATION_VERSION)
            .build();
        this.meter = meterProvider.meterBuilder(INSTRUMENTATION_NAME)
            .setInstrumentationVersion(INSTRUMENTATION_VERSION)
            .build();
    }

    public static Builder builder() {
        return new Builder(GlobalOpenTelemetry.get());
    }

    public static Builder builder(OpenTelemetry openTelemetry) {
        return new Builder(openTelemetry);
    }

    public boolean hasServerAddress() {
        return serverAddress != null && !serverAddress.isEmpty();
    }

    public boolean hasServerPort() {
        return serverPort != 0;
    }

    public boolean hasConsumerGroupId() {
        return consumerGroupId != null && !consumerGroupId.isEmpty();
    }

    @Override
    public String toString() {
        return "KafkaTelemetryConfig{" +
                "serverAddress=" + serverAddress +
                ", serverPort=" + serverPort +
                ", consumerGroupId=" + consumerGroupId +
                ", metrics=" + (meterRegistry != null ? "micrometer" : "opentelemetry") +
                '}';
    }

    /**
     * Settings are applied in call order; a later call replaces the earlier value of the same field.
     * List settings are never merged.
     */
    public static class Builder {

        private TracerProvider tracerProvider;
        private MeterProvider meterProvider;
        private TextMapPropagator propagator;
        private MeterRegistry meterRegistry;

        private String serverAddress;
        private int serverPort;
        private String consumerGroupId;

        Builder(OpenTelemetry defaults) {
            if (defaults == null) {
                defaults = OpenTelemetry.noop();
            }
            this.tracerProvider = defaults.getTracerProvider();
            this.meterProvider = defaults.getMeterProvider();
            this.propagator = defaults.getPropagators().getTextMapPropagator();
        }

        /**
         * Tracer provider used to create the tracer. {@code null} keeps the current one.
         */
        public Builder tracerProvider(TracerProvider tracerProvider) {
            if (tracerProvider != null) {
                this.tracerProvider = tracerProvider;
            }
            return this;
        }

        /**
         * Meter provider used to create the meter. {@code null} keeps the current one.
         */
        public Builder meterProvider(MeterProvider meterProvider) {
            if (meterProvider != null) {
                this.meterProvider = meterProvider;
            }
            return this;
        }

        /**
         * Propagator used to extract trace context from record headers. {@code null} keeps the current one.
         */
        public Builder propagator(TextMapPropagator propagator) {
            if (propagator != null) {
                this.propagator = propagator;
            }
            return this;
        }

        /**
         * Sends metrics to a Micrometer registry instead of the OpenTelemetry meter.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * A single {@code host[:port]} address is split into server address and port; a port that
         * does not parse or lies outside 1..65535 is left unset. Several addresses are joined with
         * {@code ;} and no port is parsed.
         */
        public Builder brokerAddresses(List<String> addresses) {
            this.serverAddress = null;
            this.serverPort = 0;
            if (addresses == null || addresses.isEmpty()) {
                return this;
            }

            if (addresses.size() == 1) {
                String[] uriParts = addresses.get(0).split(":");
                this.serverAddress = uriParts[0];
                if (uriParts.length > 1) {
                    this.serverPort = parsePort(addresses.get(0), uriParts[1]);
                }
            } else {
                this.serverAddress = String.join(";", addresses);
            }
            return this;
        }

        // 0 (unset) when not a valid TCP port
        private static int parsePort(String address, String port) {
            try {
                int parsed = Integer.parseInt(port);
                if (parsed < 1 || parsed > 65535) {
                    logger.debug("ignoring out of range broker port in {}", address);
                    return 0;
                }
                return parsed;
            } catch (NumberFormatException e) {
                logger.debug("ignoring unparseable broker port in {}", address);
                return 0;
            }
        }

        public Builder brokerAddresses(String... addresses) {
            return brokerAddresses(addresses == null ? null : List.of(addresses));
        }

        public Builder consumerGroup(String groupId) {
            this.consumerGroupId = groupId;
            return this;
        }

        public KafkaTelemetryConfig build() {
            KafkaTelemetryConfig config = new KafkaTelemetryConfig(this);
            logger.debug("resolved kafka telemetry configuration: {}", config);
            return config;
        }
    }
}
