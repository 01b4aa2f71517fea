package com.avatarflow.pipeline.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Lease lock in Redis so only one service instance sweeps due posts per tick. The holder
 * renews the lease before every publish; it expires on its own if the holder dies.
 */
@Slf4j
public class RedisDispatchLock implements DispatchLock {

    static final String LOCK_KEY = "pipeline:dispatch:lock";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final RedisScript<Long> RENEW_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final Duration lease;
    private volatile String token;

    public RedisDispatchLock(StringRedisTemplate redisTemplate, Duration lease) {
        this.redisTemplate = redisTemplate;
        this.lease = lease;
    }

    @Override
    public boolean tryAcquire() {
        String candidate = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY, candidate, lease);
            if (Boolean.TRUE.equals(acquired)) {
                token = candidate;
                return true;
            }
            return false;
        } catch (RuntimeException e) {
            log.warn("Dispatch lock unavailable, skipping tick: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean renew() {
        String held = token;
        if (held == null) {
            return false;
        }
        try {
            Long renewed = redisTemplate.execute(RENEW_SCRIPT, List.of(LOCK_KEY), held,
                    String.valueOf(lease.toMillis()));
            if (renewed != null && renewed == 1L) {
                return true;
            }
            log.warn("Dispatch lease expired and was taken over, stopping sweep");
        } catch (RuntimeException e) {
            log.warn("Could not renew dispatch lease, stopping sweep: {}", e.getMessage());
        }
        token = null;
        return false;
    }

    @Override
    public void release() {
        String held = token;
        if (held == null) {
            return;
        }
        token = null;
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(LOCK_KEY), held);
        } catch (RuntimeException e) {
            log.warn("Failed to release dispatch lock, it will expire after {}: {}", lease, e.getMessage());
        }
    }
}
