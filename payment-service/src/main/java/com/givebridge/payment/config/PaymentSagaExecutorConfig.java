package com.givebridge.payment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool that runs sagas after the request thread has taken the lock and written the
 * PENDING row. A full queue rejects new sagas instead of growing without limit.
 */
@Configuration
public class PaymentSagaExecutorConfig {

    @Bean(name = "paymentSagaExecutor")
    public ThreadPoolTaskExecutor paymentSagaExecutor(PaymentSagaProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getCorePoolSize());
        executor.setMaxPoolSize(properties.getExecutor().getMaxPoolSize());
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("payment-saga-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
