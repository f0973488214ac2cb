/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.uistudio.lock.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uistudio.lock.bus.InMemoryNotificationBus;
import com.uistudio.lock.bus.KafkaNotificationBus;
import com.uistudio.lock.bus.NotificationBus;
import com.uistudio.lock.coordinator.ContextIdSource;
import com.uistudio.lock.coordinator.LockCoordinator;
import com.uistudio.lock.coordinator.UuidContextIdSource;
import com.uistudio.lock.ledger.InMemoryLockLedger;
import com.uistudio.lock.ledger.JdbcLockLedger;
import com.uistudio.lock.ledger.LockLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;

/**
 * Wires the coordinator of this process to its ledger, bus, clock and identity.
 */
@Slf4j
@Configuration
public class CoordinatorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock lockClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextIdSource contextIdSource() {
        return new UuidContextIdSource();
    }

    @Bean
    @ConditionalOnProperty(prefix = "uistudio.lock.ledger", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public LockLedger jdbcLockLedger(NamedParameterJdbcTemplate jdbc, LockConfig lockConfig) {
        log.info("Using JDBC lock ledger, table {}", lockConfig.getLedger().getTable());
        var ledger = new JdbcLockLedger(jdbc, lockConfig.getLedger().getTable());
        ledger.createTableIfMissing();
        return ledger;
    }

    @Bean
    @ConditionalOnProperty(prefix = "uistudio.lock.ledger", name = "type", havingValue = "memory")
    public LockLedger inMemoryLockLedger() {
        log.info("Using in-memory lock ledger");
        return new InMemoryLockLedger();
    }

    @Bean
    @ConditionalOnProperty(prefix = "uistudio.lock.bus", name = "type", havingValue = "memory", matchIfMissing = true)
    public NotificationBus inMemoryNotificationBus() {
        log.info("Using in-memory notification bus");
        return new InMemoryNotificationBus();
    }

    @Bean
    @ConditionalOnProperty(prefix = "uistudio.lock.bus", name = "type", havingValue = "kafka")
    public NotificationBus kafkaNotificationBus(KafkaTemplate<String, String> kafkaTemplate,
                                                ConsumerFactory<String, String> consumerFactory,
                                                LockConfig lockConfig) {
        log.info("Using Kafka notification bus on topic {}", lockConfig.getTopic());
        return new KafkaNotificationBus(kafkaTemplate, consumerFactory, lockConfig.getBus().getGroupPrefix());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public LockCoordinator lockCoordinator(LockLedger ledger, NotificationBus bus, Clock lockClock,
                                           ContextIdSource contextIdSource, ObjectMapper objectMapper,
                                           LockConfig lockConfig) {
        return new LockCoordinator(ledger, bus, lockClock, contextIdSource, objectMapper, lockConfig);
    }
}
