package com.slipsafe.claims.core;

import com.slipsafe.claims.domain.ClaimType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Short-lived Redis lock serializing claim issuance per (purchase, claim type), so two concurrent
 * requests cannot both mint a claim. Fails open when Redis is unreachable.
 */
@Slf4j
@Component
public class IssuanceGuard {

    private static final String KEY_PREFIX = "claims:issuance:";

    private final RedisTemplate<String, String> redisTemplate;

    @Value("${claims.issuance.lock-ttl-seconds:10}")
    private long lockTtlSeconds;

    public IssuanceGuard(@Qualifier("issuanceGuardRedisTemplate") RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public enum Outcome {
        /** This caller holds the lock and must release it. */
        ACQUIRED,
        /** Another caller is issuing right now. */
        HELD_ELSEWHERE,
        /** Redis unavailable; proceed without the lock. */
        UNAVAILABLE
    }

    /**
     * Handle on an acquisition attempt; closing releases the lock only if it was acquired.
     */
    public static final class Lock implements AutoCloseable {
        private final Outcome outcome;
        private final Runnable release;

        Lock(Outcome outcome, Runnable release) {
            this.outcome = outcome;
            this.release = release;
        }

        public Outcome getOutcome() {
            return outcome;
        }

        @Override
        public void close() {
            if (outcome == Outcome.ACQUIRED) {
                release.run();
            }
        }
    }

    public Lock acquire(String purchaseId, ClaimType claimType) {
        String key = KEY_PREFIX + purchaseId + ":" + claimType.name();
        String token = UUID.randomUUID().toString();
        try {
            Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, Duration.ofSeconds(lockTtlSeconds));
            if (Boolean.TRUE.equals(acquired)) {
                log.debug("Issuance lock acquired key={}", key);
                return new Lock(Outcome.ACQUIRED, () -> release(key, token));
            }
            log.debug("Issuance lock held elsewhere key={}", key);
            return new Lock(Outcome.HELD_ELSEWHERE, () -> { });
        } catch (Exception e) {
            log.warn("Issuance lock unavailable for key={} (Redis unavailable), proceeding without lock: {}",
                    key, e.getMessage());
            return new Lock(Outcome.UNAVAILABLE, () -> { });
        }
    }

    private void release(String key, String token) {
        try {
            if (token.equals(redisTemplate.opsForValue().get(key))) {
                redisTemplate.delete(key);
            }
        } catch (Exception e) {
            log.warn("Failed to release issuance lock key={} (expires in {}s): {}", key, lockTtlSeconds, e.getMessage());
        }
    }
}
