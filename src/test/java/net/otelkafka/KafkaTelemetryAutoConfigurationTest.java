package net.otelkafka;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import net.otelkafka.Kafka.Config.KafkaTelemetryAutoConfiguration;
import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;
import net.otelkafka.Kafka.Config.KafkaTelemetryProperties;
import net.otelkafka.Kafka.Interceptor.TracingRecordInterceptor;
import net.otelkafka.Kafka.KafkaConsumerTelemetry;
import net.otelkafka.Kafka.Process.MessageProcessInstrumenter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class KafkaTelemetryAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(KafkaTelemetryAutoConfiguration.class))
        .withBean(OpenTelemetry.class, OpenTelemetry::noop);

    @AfterEach
    void tearDown() {
        GlobalOpenTelemetry.resetForTest();
    }

    @Test
    void testDefaultBeansAreRegistered() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertNotNull(context.getBean(KafkaTelemetryConfig.class));
            assertNotNull(context.getBean(KafkaConsumerTelemetry.class));
            assertSame(context.getBean(KafkaConsumerTelemetry.class).processInstrumenter(),
                context.getBean(MessageProcessInstrumenter.class));
            assertNotNull(context.getBean(TracingRecordInterceptor.class));
        });
    }

    @Test
    void testOwnPropertiesConfigureAttributes() {
        contextRunner
            .withPropertyValues(
                "otel.kafka.broker-addresses=broker-1:9093",
                "otel.kafka.consumer-group=billing")
            .run(context -> {
                KafkaTelemetryConfig config = context.getBean(KafkaTelemetryConfig.class);
                assertEquals("broker-1", config.getServerAddress());
                assertEquals(9093, config.getServerPort());
                assertEquals("billing", config.getConsumerGroupId());
            });
    }

    @Test
    void testFallsBackToSpringKafkaProperties() {
        contextRunner
            .withPropertyValues(
                "spring.kafka.bootstrap-servers=a:9092,b:9092",
                "spring.kafka.consumer.group-id=orders-service")
            .run(context -> {
                KafkaTelemetryConfig config = context.getBean(KafkaTelemetryConfig.class);
                assertEquals("a:9092;b:9092", config.getServerAddress());
                assertFalse(config.hasServerPort());
                assertEquals("orders-service", config.getConsumerGroupId());
            });
    }

    @Test
    void testOutOfRangeBootstrapPortDoesNotFailStartup() {
        contextRunner
            .withPropertyValues("spring.kafka.bootstrap-servers=host:70000")
            .run(context -> {
                assertNull(context.getStartupFailure());
                KafkaTelemetryConfig config = context.getBean(KafkaTelemetryConfig.class);
                assertEquals("host", config.getServerAddress());
                assertFalse(config.hasServerPort());
            });
    }

    @Test
    void testDisabledRegistersNothing() {
        contextRunner
            .withPropertyValues("otel.kafka.enabled=false")
            .run(context -> {
                assertTrue(context.getBeansOfType(KafkaTelemetryConfig.class).isEmpty());
                assertTrue(context.getBeansOfType(KafkaConsumerTelemetry.class).isEmpty());
            });
    }

    @Test
    void testMicrometerBackendUsesRegistry() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .withPropertyValues("otel.kafka.metrics-backend=micrometer")
            .run(context -> {
                KafkaTelemetryConfig config = context.getBean(KafkaTelemetryConfig.class);
                assertSame(context.getBean(MeterRegistry.class), config.getMeterRegistry());
                assertEquals(KafkaTelemetryProperties.MetricsBackend.MICROMETER,
                    context.getBean(KafkaTelemetryProperties.class).getMetricsBackend());
            });
    }

    @Test
    void testMicrometerRegistryIgnoredByDefault() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> assertNull(context.getBean(KafkaTelemetryConfig.class).getMeterRegistry()));
    }

    @Test
    void testUserConfigTakesPrecedence() {
        KafkaTelemetryConfig custom = KafkaTelemetryConfig.builder(OpenTelemetry.noop())
            .consumerGroup("custom")
            .build();

        contextRunner
            .withBean(KafkaTelemetryConfig.class, () -> custom)
            .run(context -> {
                assertSame(custom, context.getBean(KafkaTelemetryConfig.class));
                assertSame(custom, context.getBean(KafkaConsumerTelemetry.class).config());
            });
    }

    @Test
    void testWithoutOpenTelemetryBeanUsesGlobal() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(KafkaTelemetryAutoConfiguration.class))
            .run(context -> assertNotNull(context.getBean(KafkaTelemetryConfig.class).getTracer()));
    }

    @Test
    void testNullMetricsBackendIsRejected() {
        KafkaTelemetryProperties properties = new KafkaTelemetryProperties();

        assertThrows(IllegalArgumentException.class, () -> properties.setMetricsBackend(null));
        properties.setBrokerAddresses(null);
        assertTrue(properties.getBrokerAddresses().isEmpty());
    }
}
