package net.otelkafka.Kafka.Dispatch;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Source of consumed records, delivered one at a time through a channel.
 * The channel is closed when the source has no more records.
 */
public interface ConsumerMessagesDispatcher<K, V> {

    /**
     * @return the channel records arrive on
     */
    MessageChannel<ConsumerRecord<K, V>> messages();
}
