/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.bus;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.kafka.support.SendResult;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaNotificationBus with a mocked template and listener container.
 */
class KafkaNotificationBusTest {

    private KafkaTemplate<String, String> kafkaTemplate;
    private KafkaMessageListenerContainer<String, String> container;
    private AtomicReference<ContainerProperties> capturedProperties;
    private KafkaNotificationBus bus;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        container = mock(KafkaMessageListenerContainer.class);
        capturedProperties = new AtomicReference<>();
        bus = new KafkaNotificationBus(kafkaTemplate, props -> {
            capturedProperties.set(props);
            return container;
        }, "ui-studio-locks");
    }

    @Test
    @DisplayName("Publish should send the message to the topic")
    void publishShouldSend() {
        when(kafkaTemplate.send("locks", "payload"))
                .thenReturn(new CompletableFuture<SendResult<String, String>>());

        bus.publish("locks", "payload");

        verify(kafkaTemplate).send("locks", "payload");
    }

    @Test
    @DisplayName("Asynchronous send failure should only be logged")
    void asyncFailureShouldNotThrow() {
        when(kafkaTemplate.send("locks", "payload"))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker down")));

        assertDoesNotThrow(() -> bus.publish("locks", "payload"));
    }

    @Test
    @DisplayName("Synchronous send failure should become a BusException")
    void syncFailureShouldBecomeBusException() {
        when(kafkaTemplate.send("locks", "payload")).thenThrow(new IllegalStateException("producer closed"));

        var error = assertThrows(BusException.class, () -> bus.publish("locks", "payload"));
        assertTrue(error.getMessage().contains("locks"));
    }

    @Test
    @DisplayName("Each subscription should use its own consumer group starting at the latest offset")
    @SuppressWarnings("unchecked")
    void subscribeShouldConfigureBroadcastConsumer() {
        List<String> received = new ArrayList<>();

        bus.subscribe("locks", received::add);

        var props = capturedProperties.get();
        assertNotNull(props);
        assertArrayEquals(new String[] {"locks"}, props.getTopics());
        assertTrue(props.getGroupId().startsWith("ui-studio-locks-"));
        assertEquals("latest",
                props.getKafkaConsumerProperties().getProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
        verify(container).start();

        var listener = (MessageListener<String, String>) props.getMessageListener();
        listener.onMessage(new ConsumerRecord<>("locks", 0, 0L, null, "payload"));
        assertEquals(List.of("payload"), received);
    }

    @Test
    @DisplayName("Two subscriptions should not share a consumer group")
    void subscriptionsShouldNotShareGroup() {
        bus.subscribe("locks", message -> { });
        var firstGroup = capturedProperties.get().getGroupId();
        bus.subscribe("locks", message -> { });
        var secondGroup = capturedProperties.get().getGroupId();

        assertNotEquals(firstGroup, secondGroup);
    }

    @Test
    @DisplayName("Unsubscribe should stop a running container")
    void unsubscribeShouldStopContainer() {
        when(container.isRunning()).thenReturn(true, false);

        var subscription = bus.subscribe("locks", message -> { });
        subscription.unsubscribe();
        subscription.unsubscribe();

        verify(container, times(1)).stop();
    }

    @Test
    @DisplayName("Container start failure should become a BusException")
    void startFailureShouldBecomeBusException() {
        doThrow(new IllegalStateException("no broker")).when(container).start();

        assertThrows(BusException.class, () -> bus.subscribe("locks", message -> { }));
    }
}
