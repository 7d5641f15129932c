package com.cred.freestyle.storefront.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis lock using SET NX PX, released with a compare-and-delete script.
 * Used to serialize all edits of one owner's cart across application instances.
 *
 * Lock Pattern:
 * - SET key token NX PX expiry: only one holder, auto-expiry if the holder dies
 * - Each acquisition gets its own token; release deletes the key only while it still holds that token
 *
 * @author Storefront Team
 */
@Service
public class RedisDistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class
    );

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDistributedLock(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Attempt to acquire the lock once.
     *
     * @param lockKey Lock key (e.g. "lock:cart:user-123")
     * @param expiry Auto-release after this duration
     * @return Lock token if acquired, null if the lock is held or Redis is unreachable
     */
    public String acquireLock(String lockKey, Duration expiry) {
        try {
            String lockToken = UUID.randomUUID().toString();
            Boolean acquired = stringRedisTemplate.opsForValue()
                    .setIfAbsent(lockKey, lockToken, expiry);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {}", lockKey);
                return lockToken;
            }
            logger.debug("Lock already held: {}", lockKey);
            return null;
        } catch (Exception e) {
            logger.error("Error acquiring lock for key: {}", lockKey, e);
            return null;
        }
    }

    /**
     * Release the lock if it is still held with the given token.
     *
     * @return true if this call deleted the key
     */
    public boolean releaseLock(String lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        try {
            Long deleted = stringRedisTemplate.execute(
                    RELEASE_SCRIPT, Collections.singletonList(lockKey), lockToken);
            if (deleted != null && deleted > 0) {
                logger.debug("Released lock: {}", lockKey);
                return true;
            }
            logger.warn("Lock {} expired or was taken over before release", lockKey);
            return false;
        } catch (Exception e) {
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }

    /**
     * Acquire with exponential backoff until the wait budget is spent.
     *
     * @param lockKey Lock key
     * @param lockExpiry Lock expiry duration
     * @param waitTimeout Maximum time to keep retrying
     * @param initialBackoff First pause between attempts
     * @return Lock token if acquired, null if the wait budget ran out
     */
    public String acquireLockWithRetry(
            String lockKey,
            Duration lockExpiry,
            Duration waitTimeout,
            Duration initialBackoff
    ) {
        long deadline = System.currentTimeMillis() + waitTimeout.toMillis();
        long backoffMillis = initialBackoff.toMillis();
        int attempt = 0;

        while (true) {
            attempt++;
            String lockToken = acquireLock(lockKey, lockExpiry);
            if (lockToken != null) {
                return lockToken;
            }

            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            long sleepTime = Math.min(backoffMillis * (1L << Math.min(attempt - 1, 6)), 500);
            sleepTime = Math.min(sleepTime + ThreadLocalRandom.current().nextLong(25), remaining);

            try {
                Thread.sleep(sleepTime);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Lock acquisition interrupted for key: {}", lockKey);
                return null;
            }
        }

        logger.warn("Failed to acquire lock after {}ms and {} attempts: {}",
                waitTimeout.toMillis(), attempt, lockKey);
        return null;
    }
}
