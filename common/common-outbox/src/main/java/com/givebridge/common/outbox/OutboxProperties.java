package com.givebridge.common.outbox;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code outbox.*} settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "outbox")
public class OutboxProperties {

    /** Failed attempts after which an event is CANCELLED. */
    private int maxRetries = 5;

    /** Rows fetched per sweep. */
    private int batchSize = 10;

    private Duration sweepInterval = Duration.ofSeconds(30);

    /** How long a PROCESSING claim is honoured before another sweep may take the row over. */
    private Duration processingTimeout = Duration.ofMinutes(5);

    /** Run a sweep right after a transaction that wrote outbox rows commits. */
    private boolean sweepOnPublish = true;
}
