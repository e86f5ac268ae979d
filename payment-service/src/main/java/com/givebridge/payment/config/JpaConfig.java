package com.givebridge.payment.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA auditing fills {@code @CreatedDate} / {@code @LastModifiedDate} on payment transactions.
 * The outbox module registers its own entity and repository packages, which switches off Boot's
 * default scanning, so the payment packages are declared here.
 */
@Configuration
@EnableJpaAuditing
@EntityScan(basePackages = "com.givebridge.payment.entity")
@EnableJpaRepositories(basePackages = "com.givebridge.payment.repository")
public class JpaConfig {
}
