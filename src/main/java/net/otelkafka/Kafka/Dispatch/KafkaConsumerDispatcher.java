package net.otelkafka.Kafka.Dispatch;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns a Kafka consumer poll loop into a {@link ConsumerMessagesDispatcher}.
 *
 * <p>
 * The consumer must already be subscribed or assigned. {@link #run()} polls it and sends every
 * record to {@link #messages()} in poll order, so polling pauses while the downstream side is
 * busy. {@link #close()} wakes the consumer up and closes the channel; the loop then returns.
 * The Kafka consumer itself is left open for the caller to close.
 * </p>
 */
public class KafkaConsumerDispatcher<K, V> implements ConsumerMessagesDispatcher<K, V>, Runnable, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(KafkaConsumerDispatcher.class);

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<K, V> consumer;
    private final Duration pollTimeout;
    private final MessageChannel<ConsumerRecord<K, V>> messages = new MessageChannel<>();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public KafkaConsumerDispatcher(Consumer<K, V> consumer) {
        this(consumer, DEFAULT_POLL_TIMEOUT);
    }

    public KafkaConsumerDispatcher(Consumer<K, V> consumer, Duration pollTimeout) {
        if (pollTimeout == null || pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must be zero or positive");
        }
        this.consumer = consumer;
        this.pollTimeout = pollTimeout;
    }

    @Override
    public MessageChannel<ConsumerRecord<K, V>> messages() {
        return messages;
    }

    @Override
    public void run() {
        long dispatched = 0;
        try {
            while (running.get()) {
                ConsumerRecords<K, V> records = consumer.poll(pollTimeout);
                for (ConsumerRecord<K, V> record : records) {
                    messages.send(record);
                    dispatched++;
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                logger.warn("consumer woken up without close, stopping dispatch");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted while dispatching records, stopping dispatch");
        } catch (IllegalStateException e) {
            if (messages.isClosed()) {
                logger.debug("channel closed while a record was waiting for a reader, stopping dispatch");
            } else {
                logger.error("poll loop failed after {} records: {}", dispatched, e.getMessage(), e);
            }
        } catch (Exception e) {
            logger.error("poll loop failed after {} records: {}", dispatched, e.getMessage(), e);
        } finally {
            messages.close();
            logger.debug("dispatch stopped after {} records", dispatched);
        }
    }

    /**
     * Stops the poll loop. Safe to call from any thread and more than once.
     *
     * <p>
     * Wakes the consumer out of {@code poll} and closes the channel, so a loop blocked on a reader
     * that has gone away drops the record it was offering and returns.
     * </p>
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            consumer.wakeup();
            messages.close();
        }
    }
}
