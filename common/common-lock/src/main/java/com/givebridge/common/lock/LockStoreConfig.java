package com.givebridge.common.lock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Wires the Redis-backed {@link LockStore}. A service that declares its own {@link LockStore}
 * bean replaces it.
 */
@Configuration
public class LockStoreConfig {

    @Bean
    @ConditionalOnMissingBean(LockStore.class)
    public LockStore redisLockStore(StringRedisTemplate redisTemplate) {
        return new RedisLockStore(redisTemplate);
    }
}
