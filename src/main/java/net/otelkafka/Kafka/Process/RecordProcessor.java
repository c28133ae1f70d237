package net.otelkafka.Kafka.Process;

import org.apache.kafka.clients.consumer.ConsumerRecord;

/**
 * Business logic applied to one record.
 */
@FunctionalInterface
public interface RecordProcessor<K, V> {

    void process(ConsumerRecord<K, V> record) throws Exception;
}
