package com.givebridge.payment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Payment service: runs the payment saga (lock, charge, ledger, donation confirmation,
 * compensation) and delivers its events through the transactional outbox.
 *
 * <p>Scans the shared exception handler, the Redis lock store and the outbox relay from the
 * common modules. Scheduling drives the periodic outbox sweep and the stale saga recovery.</p>
 */
@SpringBootApplication(scanBasePackages = {
        "com.givebridge.payment",
        "com.givebridge.common.exception",
        "com.givebridge.common.lock",
        "com.givebridge.common.outbox"
})
@ConfigurationPropertiesScan
@EnableFeignClients
@EnableScheduling
public class PaymentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentServiceApplication.class, args);
    }
}
