package net.otelkafka.Kafka.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Kafka consumer telemetry.
 * These properties can be configured in application.properties with the prefix "otel.kafka".
 */
@ConfigurationProperties(prefix = "otel.kafka")
public class KafkaTelemetryProperties {

    /**
     * Where consumer metrics are sent.
     */
    public enum MetricsBackend {
        OPENTELEMETRY,
        MICROMETER
    }

    /**
     * Enable or disable the auto-configuration.
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Broker addresses reported as server.address / server.port.
     * Default: empty, which falls back to spring.kafka.bootstrap-servers
     */
    private List<String> brokerAddresses = new ArrayList<>();

    /**
     * Consumer group reported as messaging.consumer.group.name.
     * Default: null, which falls back to spring.kafka.consumer.group-id
     */
    private String consumerGroup;

    /**
     * Metrics backend.
     * Default: OPENTELEMETRY
     */
    private MetricsBackend metricsBackend = MetricsBackend.OPENTELEMETRY;

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getBrokerAddresses() {
        return brokerAddresses;
    }

    public void setBrokerAddresses(List<String> brokerAddresses) {
        this.brokerAddresses = brokerAddresses != null ? brokerAddresses : new ArrayList<>();
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public void setConsumerGroup(String consumerGroup) {
        this.consumerGroup = consumerGroup;
    }

    public MetricsBackend getMetricsBackend() {
        return metricsBackend;
    }

    public void setMetricsBackend(MetricsBackend metricsBackend) {
        if (metricsBackend == null) {
            throw new IllegalArgumentException("metricsBackend cannot be null");
        }
        this.metricsBackend = metricsBackend;
    }

    @Override
    public String toString() {
        return "KafkaTelemetryProperties{" +
                "enabled=" + enabled +
                ", brokerAddresses=" + brokerAddresses +
                ", consumerGroup=" + consumerGroup +
                ", metricsBackend=" + metricsBackend +
                '}';
    }
}
