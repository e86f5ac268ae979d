package com.givebridge.payment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code payment.saga.*} settings.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.saga")
public class PaymentSagaProperties {

    /** TTL of the saga lock when first acquired. */
    private Duration lockTtl = Duration.ofMinutes(15);

    /** How long a request waits for a contended lock before it is rejected as a duplicate. */
    private Duration lockWait = Duration.ofSeconds(10);

    private Duration lockRetryInterval = Duration.ofMillis(100);

    /** New TTL applied after a successful gateway charge. */
    private Duration lockExtension = Duration.ofMinutes(10);

    private final Executor executor = new Executor();
    private final Recovery recovery = new Recovery();

    @Getter
    @Setter
    public static class Executor {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 200;
    }

    @Getter
    @Setter
    public static class Recovery {
        private boolean enabled = true;

        /** Delay between recovery runs, read by the scheduler through a placeholder. */
        private Duration interval = Duration.ofMinutes(5);

        /** A saga whose row has not changed for this long is considered abandoned. */
        private Duration staleAfter = Duration.ofMinutes(30);

        private int batchSize = 20;
    }
}
