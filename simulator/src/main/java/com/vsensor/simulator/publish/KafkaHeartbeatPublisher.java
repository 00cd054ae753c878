package com.vsensor.simulator.publish;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.HashMap;
import java.util.Map;

/**
 * Publishes heartbeats to a Kafka topic keyed by sensor id, so one sensor's heartbeats share
 * a partition.
 */
public class KafkaHeartbeatPublisher implements IHeartbeatPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaHeartbeatPublisher.class);

    private final KafkaSender<String, String> sender;
    private final String topic;

    public KafkaHeartbeatPublisher(String bootstrap, String topic) {
        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "1");
        producerProps.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));
        this.topic = topic;
        log.info("Publishing heartbeats to Kafka topic {} at {}", topic, bootstrap);
    }

    @Override
    public Mono<Void> publish(String sensorId, String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, sensorId, payload);
        return sender.send(Mono.just(SenderRecord.create(record, sensorId)))
            .doOnNext(result -> {
                if (result.exception() != null) {
                    log.warn("Heartbeat for {} not sent: {}", sensorId, result.exception().getMessage());
                }
            })
            .then();
    }

    @Override
    public void close() {
        sender.close();
        log.info("Kafka sender closed");
    }
}
