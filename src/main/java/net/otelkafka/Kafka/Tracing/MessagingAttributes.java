package net.otelkafka.Kafka.Tracing;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import net.otelkafka.Kafka.Config.KafkaTelemetryConfig;

/**
 * Messaging attribute keys shared by spans and metrics.
 *
 * Names follow the OpenTelemetry messaging semantic conventions and must not change.
 */
public final class MessagingAttributes {

    public static final AttributeKey<String> MESSAGING_SYSTEM = AttributeKey.stringKey("messaging.system");

    public static final AttributeKey<String> MESSAGING_OPERATION_NAME =
        AttributeKey.stringKey("messaging.operation.name");

    public static final AttributeKey<String> MESSAGING_DESTINATION_NAME =
        AttributeKey.stringKey("messaging.destination.name");

    /**
     * Partition number, string encoded.
     */
    public static final AttributeKey<String> MESSAGING_DESTINATION_PARTITION_ID =
        AttributeKey.stringKey("messaging.destination.partition.id");

    /**
     * Record offset, string encoded. Spans only; never used on metrics.
     */
    public static final AttributeKey<String> MESSAGING_MESSAGE_ID = AttributeKey.stringKey("messaging.message.id");

    public static final AttributeKey<String> MESSAGING_CONSUMER_GROUP_NAME =
        AttributeKey.stringKey("messaging.consumer.group.name");

    public static final AttributeKey<String> SERVER_ADDRESS = AttributeKey.stringKey("server.address");

    public static final AttributeKey<Long> SERVER_PORT = AttributeKey.longKey("server.port");

    public static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");

    public static final String KAFKA = "kafka";
    public static final String RECEIVE = "receive";
    public static final String PROCESS = "process";

    private MessagingAttributes() {
    }

    /**
     * Builds the attribute set shared by every record handled under {@code operationName}.
     *
     * Receive and process get the same keys: the consumer group is added to both whenever it is
     * configured, so process series carry {@code messaging.consumer.group.name} too.
     */
    public static Attributes defaultAttributes(KafkaTelemetryConfig config, String operationName) {
        AttributesBuilder builder = Attributes.builder()
            .put(MESSAGING_SYSTEM, KAFKA)
            .put(MESSAGING_OPERATION_NAME, operationName);
        if (config.hasServerAddress()) {
            builder.put(SERVER_ADDRESS, config.getServerAddress());
        }
        if (config.hasServerPort()) {
            builder.put(SERVER_PORT, (long) config.getServerPort());
        }
        if (config.hasConsumerGroupId()) {
            builder.put(MESSAGING_CONSUMER_GROUP_NAME, config.getConsumerGroupId());
        }
        return builder.build();
    }

    /**
     * Copies {@code defaults} and adds topic and partition. {@code defaults} is left untouched.
     */
    public static Attributes withDestination(Attributes defaults, String topic, int partition) {
        return withDestination(defaults, topic, Integer.toString(partition));
    }

    public static Attributes withDestination(Attributes defaults, String topic, String partition) {
        return defaults.toBuilder()
            .put(MESSAGING_DESTINATION_NAME, topic)
            .put(MESSAGING_DESTINATION_PARTITION_ID, partition)
            .build();
    }

    /**
     * Copies {@code attributes} and adds the record offset as message id.
     */
    public static Attributes withMessageId(Attributes attributes, long offset) {
        return attributes.toBuilder()
            .put(MESSAGING_MESSAGE_ID, Long.toString(offset))
            .build();
    }
}
