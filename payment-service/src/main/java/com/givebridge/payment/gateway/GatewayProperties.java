package com.givebridge.payment.gateway;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code payment.gateway.*} settings for the simulated processor.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.gateway")
public class GatewayProperties {

    private Duration minLatency = Duration.ofSeconds(1);
    private Duration maxLatency = Duration.ofSeconds(3);

    /** Share of otherwise valid charges that are declined at random. */
    private double failureRate = 0.0;

    private double refundFailureRate = 0.0;

    /** How long a charge result is replayed for a repeated idempotency key. */
    private Duration idempotencyTtl = Duration.ofHours(24);

    private long idempotencyMaxEntries = 10_000;
}
