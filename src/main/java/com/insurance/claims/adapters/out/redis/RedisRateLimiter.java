package com.insurance.claims.adapters.out.redis;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.RateLimiter;
import com.insurance.claims.bootstrap.config.ClaimsProperties;

/**
 * Redis implementation of the RateLimiter outbound port.
 * <p>
 * Fixed window per actor. Key pattern: {@code claims:ratelimit:{actorId}}.
 * Each query counts as one submission. The increment and the window TTL are
 * applied in one Lua script, so a counter never outlives its window. An actor
 * over {@code maxSubmissions} within the window is reported as submitting too
 * frequently.
 * </p>
 */
@Component
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);

    // INCR, and start the window TTL on the first hit
    static final RedisScript<Long> INCREMENT_SCRIPT = RedisScript.of(
            "local count = redis.call('INCR', KEYS[1]) "
                    + "if count == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end "
                    + "return count",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final int maxSubmissions;
    private final Duration window;

    public RedisRateLimiter(StringRedisTemplate redisTemplate, ClaimsProperties claimsProperties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = claimsProperties.getRateLimit().getKeyPrefix();
        this.maxSubmissions = claimsProperties.getRateLimit().getMaxSubmissions();
        this.window = claimsProperties.getRateLimit().getWindow();
    }

    @Override
    public boolean isSubmittingTooFrequently(String actorId) {
        String key = keyPrefix + actorId;
        Long count = redisTemplate.execute(INCREMENT_SCRIPT, List.of(key), String.valueOf(window.toMillis()));
        if (count == null) {
            throw new IllegalStateException("Rate limit counter unavailable for actor " + actorId);
        }

        boolean limited = count > maxSubmissions;
        if (limited) {
            log.warn("action=rate_limited actorId={} count={} max={} window={}",
                    actorId, count, maxSubmissions, window);
        } else {
            log.debug("action=rate_check actorId={} count={} max={}", actorId, count, maxSubmissions);
        }
        return limited;
    }
}
