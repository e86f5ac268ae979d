package com.givebridge.common.outbox;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import java.time.Clock;

/**
 * Registers the outbox entity, repository and relay components for any service that imports
 * this module.
 */
@Configuration
@ComponentScan(basePackages = "com.givebridge.common.outbox")
@EntityScan(basePackages = "com.givebridge.common.outbox")
@EnableJpaRepositories(basePackages = "com.givebridge.common.outbox")
@EnableConfigurationProperties(OutboxProperties.class)
public class OutboxConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
