/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.bus;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;

import java.util.Properties;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Bus backed by a Kafka topic.
 *
 * <p>Every subscription gets its own consumer group so each context sees every message,
 * and starts from the latest offset because only contexts that are alive matter.
 */
@Slf4j
public class KafkaNotificationBus implements NotificationBus {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Function<ContainerProperties, KafkaMessageListenerContainer<String, String>> containerFactory;
    private final String groupPrefix;

    public KafkaNotificationBus(KafkaTemplate<String, String> kafkaTemplate,
                                ConsumerFactory<String, String> consumerFactory,
                                String groupPrefix) {
        this(kafkaTemplate, props -> new KafkaMessageListenerContainer<>(consumerFactory, props), groupPrefix);
    }

    KafkaNotificationBus(KafkaTemplate<String, String> kafkaTemplate,
                         Function<ContainerProperties, KafkaMessageListenerContainer<String, String>> containerFactory,
                         String groupPrefix) {
        this.kafkaTemplate = kafkaTemplate;
        this.containerFactory = containerFactory;
        this.groupPrefix = groupPrefix;
    }

    @Override
    public void publish(String topic, String message) {
        try {
            kafkaTemplate.send(topic, message)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish lock notification to {}: {}", topic, ex.getMessage());
                        } else {
                            log.trace("Published lock notification to {} at offset {}",
                                    topic, result.getRecordMetadata().offset());
                        }
                    });
        } catch (RuntimeException e) {
            throw new BusException("Failed to publish to topic " + topic, e);
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> handler) {
        var groupId = groupPrefix + "-" + UUID.randomUUID();

        var consumerProperties = new Properties();
        consumerProperties.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

        var containerProperties = new ContainerProperties(topic);
        containerProperties.setGroupId(groupId);
        containerProperties.setKafkaConsumerProperties(consumerProperties);
        containerProperties.setMessageListener(
                (MessageListener<String, String>) record -> handler.accept(record.value()));

        KafkaMessageListenerContainer<String, String> container;
        try {
            container = containerFactory.apply(containerProperties);
            container.setBeanName(groupId);
            container.start();
        } catch (KafkaException | IllegalStateException e) {
            throw new BusException("Failed to subscribe to topic " + topic, e);
        }
        log.info("Subscribed to lock topic {} as consumer group {}", topic, groupId);

        return () -> {
            if (container.isRunning()) {
                container.stop();
                log.info("Stopped lock topic consumer {}", groupId);
            }
        };
    }
}
