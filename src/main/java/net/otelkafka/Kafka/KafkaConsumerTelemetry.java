package net.otelkafka.Kafka;

import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;
import net.otelkafka.Kafka.Dispatch.ConsumerMessagesDispatcher;
import net.otelkafka.Kafka.Dispatch.ConsumerMessagesDispatcherWrapper;
import net.otelkafka.Kafka.Metrics.MetricsRecorder;
import net.otelkafka.Kafka.Metrics.MetricsRecorders;
import net.otelkafka.Kafka.Process.MessageProcessInstrumenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point tying a {@link KafkaTelemetryConfig} to the consumer instrumentation.
 *
 * <pre>
 * KafkaConsumerTelemetry telemetry = new KafkaConsumerTelemetry(KafkaTelemetryConfig.builder()
 *     .brokerAddresses("localhost:9092")
 *     .consumerGroup("orders")
 *     .build());
 *
 * ConsumerMessagesDispatcher&lt;String, String&gt; traced = telemetry.wrap(new KafkaConsumerDispatcher&lt;&gt;(consumer));
 * for (ConsumerRecord&lt;String, String&gt; record : traced.messages()) {
 *     telemetry.processInstrumenter().process(record, this::handle);
 * }
 * </pre>
 */
public class KafkaConsumerTelemetry {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConsumerTelemetry.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final KafkaTelemetryConfig config;
    private final MetricsRecorder metricsRecorder;
    private final MessageProcessInstrumenter processInstrumenter;

    public KafkaConsumerTelemetry(KafkaTelemetryConfig config) {
        this.config = config;
        this.metricsRecorder = MetricsRecorders.create(config);
        this.processInstrumenter = new MessageProcessInstrumenter(config, metricsRecorder);
        logger.info("kafka consumer telemetry initialized - {}", config);
    }

    /**
     * Wraps {@code dispatcher} and starts forwarding its records on a new daemon thread.
     *
     * <p>
     * To shut down, close the wrapped dispatcher and the returned wrapper. Closing the wrapper ends
     * its thread even when nothing reads its output any more.
     * </p>
     *
     * @return the wrapper; read records from its {@link ConsumerMessagesDispatcherWrapper#messages()}
     */
    public <K, V> ConsumerMessagesDispatcherWrapper<K, V> wrap(ConsumerMessagesDispatcher<K, V> dispatcher) {
        ConsumerMessagesDispatcherWrapper<K, V> wrapper =
            new ConsumerMessagesDispatcherWrapper<>(dispatcher, config, metricsRecorder);

        Thread thread = new Thread(wrapper, "otel-kafka-dispatcher-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            logger.error("dispatcher thread {} failed: {}", t.getName(), e.getMessage(), e));
        thread.start();
        logger.debug("started {}", thread.getName());
        return wrapper;
    }

    public MessageProcessInstrumenter processInstrumenter() {
        return processInstrumenter;
    }

    public KafkaTelemetryConfig config() {
        return config;
    }
}
