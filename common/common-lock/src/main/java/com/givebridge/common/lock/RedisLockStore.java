package com.givebridge.common.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

/**
 * {@link LockStore} on Redis.
 *
 * <ul>
 *   <li>acquire: {@code SET key token NX PX ttl}</li>
 *   <li>extend: Lua {@code GET == token -> PEXPIRE}</li>
 *   <li>release: Lua {@code GET == token -> DEL}</li>
 * </ul>
 *
 * <p>The compare-and-act steps run as Lua scripts so the check and the write are a single
 * atomic Redis operation.</p>
 */
@Slf4j
public class RedisLockStore implements LockStore {

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> releaseScript;
    private final DefaultRedisScript<Long> extendScript;

    public RedisLockStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.releaseScript = loadScript("lock/release.lua");
        this.extendScript = loadScript("lock/extend.lua");
    }

    @Override
    public boolean tryAcquire(String key, String token, Duration ttl) {
        Boolean created = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public boolean extend(String key, String token, Duration ttl) {
        long ttlMillis = Math.max(1, ttl.toMillis());
        Long res = redisTemplate.execute(extendScript, Collections.singletonList(key),
                token, Long.toString(ttlMillis));
        return Long.valueOf(1L).equals(res);
    }

    @Override
    public boolean release(String key, String token) {
        Long res = redisTemplate.execute(releaseScript, Collections.singletonList(key), token);
        if (!Long.valueOf(1L).equals(res)) {
            log.debug("Lock already gone on release: key={}", key);
            return false;
        }
        return true;
    }

    @Override
    public boolean isHeldBy(String key, String token) {
        return token.equals(redisTemplate.opsForValue().get(key));
    }

    private DefaultRedisScript<Long> loadScript(String path) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(path));
        script.setResultType(Long.class);
        return script;
    }
}
