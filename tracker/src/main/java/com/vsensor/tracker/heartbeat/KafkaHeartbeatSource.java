package com.vsensor.tracker.heartbeat;

import com.vsensor.core.msg.Channels;
import com.vsensor.core.util.JitterBackoff;
import com.vsensor.tracker.config.TrackerConfig;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.util.retry.Retry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Heartbeats from a Kafka topic.
 * <p>
 * All tracker nodes share one consumer group, so each heartbeat is applied by exactly one
 * node. Sensors key their records by id, which keeps one sensor's heartbeats on one
 * partition and therefore in order.
 * </p>
 */
public class KafkaHeartbeatSource implements IHeartbeatSource {
    private static final Logger log = LoggerFactory.getLogger(KafkaHeartbeatSource.class);

    private static final int DEFAULT_PARTITIONS = 3;
    private static final short REPLICATION_FACTOR = 1;

    private final TrackerConfig config;
    private final AdminClient adminClient;
    private final KafkaReceiver<String, String> receiver;

    public KafkaHeartbeatSource(TrackerConfig config) {
        this.config = config;

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, Channels.TRACKER_CONSUMER_GROUP);
        consumerProps.put(ConsumerConfig.CLIENT_ID_CONFIG, "vsensor-tracker-" + config.getNodeId());
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // Stale heartbeats are useless after a restart
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

        ReceiverOptions<String, String> options = ReceiverOptions.<String, String>create(consumerProps)
            .subscription(Collections.singleton(config.getHeartbeatTopic()));
        this.receiver = KafkaReceiver.create(options);

        log.info("Kafka heartbeat source initialized: topic={}, bootstrap={}",
            config.getHeartbeatTopic(), config.getKafkaBootstrap());
    }

    @Override
    public Flux<String> heartbeats() {
        return createTopicIfNotExists(config.getHeartbeatTopic())
            .thenMany(receiver.receive())
            .map(record -> {
                record.receiverOffset().acknowledge();
                return record.value();
            })
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                long attempt = signal.totalRetriesInARow();
                log.warn("Heartbeat topic {} failed (attempt {}), resubscribing: {}",
                    config.getHeartbeatTopic(), attempt + 1, signal.failure().getMessage());
                return Mono.delay(JitterBackoff.next(attempt));
            })));
    }

    private Mono<Void> createTopicIfNotExists(String topicName) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }
                log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                    topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR);
                NewTopic newTopic = new NewTopic(topicName, DEFAULT_PARTITIONS, REPLICATION_FACTOR);
                return Mono.fromFuture(() -> adminClient.createTopics(Collections.singleton(newTopic))
                        .all().toCompletionStage().toCompletableFuture())
                    .onErrorResume(TopicExistsException.class, e -> Mono.empty())
                    .onErrorResume(err -> err.getCause() instanceof TopicExistsException, e -> Mono.empty())
                    .then();
            });
    }

    @Override
    public void close() {
        adminClient.close();
        log.info("Kafka heartbeat source closed");
    }
}
