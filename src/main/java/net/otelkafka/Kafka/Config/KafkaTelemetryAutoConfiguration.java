package net.otelkafka.Kafka.Config;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import net.otelkafka.Kafka.Interceptor.TracingRecordInterceptor;
import net.otelkafka.Kafka.KafkaConsumerTelemetry;
import net.otelkafka.Kafka.Process.MessageProcessInstrumenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Auto-configuration for Kafka consumer telemetry.
 * Provides default beans that users can override if needed.
 *
 * Can be disabled by setting: otel.kafka.enabled=false
 */
@AutoConfiguration
@ConditionalOnProperty(
        prefix = "otel.kafka",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true
)
@EnableConfigurationProperties(KafkaTelemetryProperties.class)
public class KafkaTelemetryAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(KafkaTelemetryAutoConfiguration.class);

    /**
     * Uses the application's OpenTelemetry bean when there is one, otherwise whatever is
     * registered globally at startup.
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaTelemetryConfig kafkaTelemetryConfig(KafkaTelemetryProperties properties,
                                                     Environment environment,
                                                     @Nullable OpenTelemetry openTelemetry,
                                                     @Nullable MeterRegistry meterRegistry) {
        if (openTelemetry == null) {
            logger.debug("no OpenTelemetry bean found - using GlobalOpenTelemetry");
            openTelemetry = GlobalOpenTelemetry.get();
        }

        KafkaTelemetryConfig.Builder builder = KafkaTelemetryConfig.builder(openTelemetry)
                .brokerAddresses(resolveBrokerAddresses(properties, environment))
                .consumerGroup(resolveConsumerGroup(properties, environment));

        if (properties.getMetricsBackend() == KafkaTelemetryProperties.MetricsBackend.MICROMETER) {
            if (meterRegistry != null) {
                builder.meterRegistry(meterRegistry);
            } else {
                logger.warn("otel.kafka.metrics-backend=micrometer but no MeterRegistry bean found - " +
                        "falling back to OpenTelemetry metrics");
            }
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public KafkaConsumerTelemetry kafkaConsumerTelemetry(KafkaTelemetryConfig kafkaTelemetryConfig) {
        return new KafkaConsumerTelemetry(kafkaTelemetryConfig);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageProcessInstrumenter messageProcessInstrumenter(KafkaConsumerTelemetry kafkaConsumerTelemetry) {
        return kafkaConsumerTelemetry.processInstrumenter();
    }

    /**
     * Not registered on any container automatically; set it on your listener container factory.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(name = "org.springframework.kafka.listener.RecordInterceptor")
    public TracingRecordInterceptor<Object, Object> tracingRecordInterceptor(
            MessageProcessInstrumenter messageProcessInstrumenter) {
        return new TracingRecordInterceptor<>(messageProcessInstrumenter);
    }

    static List<String> resolveBrokerAddresses(KafkaTelemetryProperties properties, Environment environment) {
        if (!properties.getBrokerAddresses().isEmpty()) {
            return properties.getBrokerAddresses();
        }
        return Binder.get(environment)
                .bind("spring.kafka.bootstrap-servers", Bindable.listOf(String.class))
                .orElse(List.of());
    }

    static String resolveConsumerGroup(KafkaTelemetryProperties properties, Environment environment) {
        if (properties.getConsumerGroup() != null && !properties.getConsumerGroup().isEmpty()) {
            return properties.getConsumerGroup();
        }
        return environment.getProperty("spring.kafka.consumer.group-id");
    }
}
