package com.insurance.claims.adapters.out.memory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.insurance.claims.application.port.out.InFlightGuard;

/**
 * Process-local in-flight guard for single-instance deployments.
 * <p>
 * One entry per actor holding the owner token. Acquire and release are single
 * atomic map operations.
 * </p>
 */
@Component
@ConditionalOnProperty(prefix = "claims.in-flight", name = "store", havingValue = "local")
public class LocalInFlightGuard implements InFlightGuard {

    private static final Logger log = LoggerFactory.getLogger(LocalInFlightGuard.class);

    private final Map<String, String> holders = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(String actorId, String token) {
        String existing = holders.putIfAbsent(actorId, token);
        if (existing != null) {
            log.debug("action=guard_busy actorId={} holder={}", actorId, existing);
            return false;
        }
        log.debug("action=guard_acquired actorId={} token={}", actorId, token);
        return true;
    }

    @Override
    public void release(String actorId, String token) {
        boolean released = holders.remove(actorId, token);
        log.debug("action=guard_released actorId={} token={} released={}", actorId, token, released);
    }

    /** @return true if some attempt currently holds the actor's guard */
    public boolean isHeld(String actorId) {
        return holders.containsKey(actorId);
    }
}
