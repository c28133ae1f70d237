package net.otelkafka.Kafka.Interceptor;

import net.otelkafka.Kafka.Process.MessageProcessInstrumenter;
import net.otelkafka.Kafka.Process.MessageProcessOperation;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.RecordInterceptor;
import org.springframework.lang.Nullable;

/**
 * Spring Kafka interceptor that wraps every listener invocation in a process operation.
 *
 * <p>
 * Register it on the container factory:
 * </p>
 * <pre>
 * factory.setRecordInterceptor(tracingRecordInterceptor);
 * </pre>
 *
 * The operation lives on the listener thread between {@link #intercept} and {@link #afterRecord}.
 */
public class TracingRecordInterceptor<K, V> implements RecordInterceptor<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(TracingRecordInterceptor.class);

    private final MessageProcessInstrumenter instrumenter;
    private final ThreadLocal<MessageProcessOperation> currentOperation = new ThreadLocal<>();

    public TracingRecordInterceptor(MessageProcessInstrumenter instrumenter) {
        this.instrumenter = instrumenter;
    }

    @Override
    @Nullable
    public ConsumerRecord<K, V> intercept(ConsumerRecord<K, V> record, Consumer<K, V> consumer) {
        MessageProcessOperation stale = currentOperation.get();
        if (stale != null) {
            // afterRecord was skipped for the previous record
            logger.warn("process operation for {}-{} was never stopped, stopping it now",
                stale.getTopic(), stale.getPartition());
            stale.stop();
        }
        currentOperation.set(instrumenter.newProcessOperation(record));
        return record;
    }

    @Override
    public void failure(ConsumerRecord<K, V> record, Exception exception, Consumer<K, V> consumer) {
        MessageProcessOperation operation = currentOperation.get();
        if (operation != null) {
            operation.setError(exception);
        }
    }

    @Override
    public void afterRecord(ConsumerRecord<K, V> record, Consumer<K, V> consumer) {
        MessageProcessOperation operation = currentOperation.get();
        if (operation == null) {
            logger.debug("no process operation bound for {}-{}@{}", record.topic(), record.partition(), record.offset());
            return;
        }
        currentOperation.remove();
        operation.stop();
    }
}
