package com.insurance.claims.adapters.out.redis;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.InFlightGuard;
import com.insurance.claims.bootstrap.config.ClaimsProperties;

/**
 * Redis implementation of the InFlightGuard outbound port.
 * <p>
 * Key pattern: {@code claims:inflight:{actorId}}, value = owner token.
 * Acquire is {@code SET NX} with a TTL so a crashed holder cannot block the
 * actor forever. Release deletes the key only when it still holds the
 * caller's token (compare-and-delete script).
 * </p>
 */
@Component
@ConditionalOnProperty(prefix = "claims.in-flight", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisInFlightGuard implements InFlightGuard {

    private static final Logger log = LoggerFactory.getLogger(RedisInFlightGuard.class);

    static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisInFlightGuard(StringRedisTemplate redisTemplate, ClaimsProperties claimsProperties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = claimsProperties.getInFlight().getKeyPrefix();
        this.ttl = claimsProperties.getInFlight().getTtl();
    }

    @Override
    public boolean tryAcquire(String actorId, String token) {
        String key = buildKey(actorId);
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, ttl);

        if (Boolean.TRUE.equals(acquired)) {
            log.debug("action=guard_acquired actorId={} token={} ttl={}", actorId, token, ttl);
            return true;
        }
        log.debug("action=guard_busy actorId={} holder={}", actorId, redisTemplate.opsForValue().get(key));
        return false;
    }

    @Override
    public void release(String actorId, String token) {
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, List.of(buildKey(actorId)), token);
        if (deleted == null || deleted == 0L) {
            log.warn("action=guard_release_skipped actorId={} token={} reason=not_owner_or_expired",
                    actorId, token);
            return;
        }
        log.debug("action=guard_released actorId={} token={}", actorId, token);
    }

    private String buildKey(String actorId) {
        return keyPrefix + actorId;
    }
}
