package net.otelkafka;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import net.otelkafka.Kafka.Interceptor.TracingRecordInterceptor;
import net.otelkafka.Kafka.Metrics.MetricsRecorder;
import net.otelkafka.Kafka.Process.MessageProcessInstrumenter;
import net.otelkafka.Kafka.Tracing.MessagingAttributes;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(MockitoExtension.class)
class TracingRecordInterceptorTest {

    @Mock
    private Consumer<String, String> consumer;

    private InMemoryTelemetry telemetry;
    private TracingRecordInterceptor<String, String> interceptor;

    @BeforeEach
    void setUp() {
        telemetry = new InMemoryTelemetry();
        interceptor = new TracingRecordInterceptor<>(new MessageProcessInstrumenter(telemetry.configBuilder().build()));
    }

    @AfterEach
    void tearDown() {
        telemetry.close();
    }

    @Test
    void testInterceptReturnsRecordAndAfterRecordEndsSpan() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 1);

        assertSame(record, interceptor.intercept(record, consumer));
        assertTrue(telemetry.spans().isEmpty(), "span stays open while the listener runs");

        interceptor.success(record, consumer);
        interceptor.afterRecord(record, consumer);

        assertEquals(1, telemetry.spansNamed("orders process").size());
        HistogramPointData point = telemetry.histogramPoints(MetricsRecorder.PROCESS_DURATION).get(0);
        assertNull(point.getAttributes().get(MessagingAttributes.ERROR_TYPE));
    }

    @Test
    void testFailureIsRecordedAsErrorType() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 2);

        interceptor.intercept(record, consumer);
        interceptor.failure(record, new IllegalStateException("listener failed"), consumer);
        interceptor.afterRecord(record, consumer);

        HistogramPointData point = telemetry.histogramPoints(MetricsRecorder.PROCESS_DURATION).get(0);
        assertEquals("listener failed", point.getAttributes().get(MessagingAttributes.ERROR_TYPE));
    }

    @Test
    void testUnstoppedOperationIsEndedByNextIntercept() {
        ConsumerRecord<String, String> first = InMemoryTelemetry.record("orders", 0, 3);
        ConsumerRecord<String, String> second = InMemoryTelemetry.record("orders", 0, 4);

        interceptor.intercept(first, consumer);
        interceptor.intercept(second, consumer);
        assertEquals(1, telemetry.spans().size());

        interceptor.afterRecord(second, consumer);
        assertEquals(2, telemetry.spansNamed("orders process").size());
    }

    @Test
    void testStaleOperationWarningNamesItsOwnRecord() {
        Logger logger = (Logger) LoggerFactory.getLogger(TracingRecordInterceptor.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            interceptor.intercept(InMemoryTelemetry.record("orders", 1, 3), consumer);
            interceptor.intercept(InMemoryTelemetry.record("payments", 0, 4), consumer);
        } finally {
            logger.detachAppender(appender);
        }

        ILoggingEvent warning = appender.list.stream()
            .filter(event -> event.getLevel() == Level.WARN)
            .findFirst()
            .orElseThrow();
        assertEquals("process operation for orders-1 was never stopped, stopping it now",
            warning.getFormattedMessage());
    }

    @Test
    void testAfterRecordWithoutInterceptIsIgnored() {
        ConsumerRecord<String, String> record = InMemoryTelemetry.record("orders", 0, 5);

        interceptor.failure(record, new IllegalStateException("ignored"), consumer);
        interceptor.afterRecord(record, consumer);

        assertTrue(telemetry.spans().isEmpty());
        assertTrue(telemetry.histogramPoints(MetricsRecorder.PROCESS_DURATION).isEmpty());
    }
}
