package com.insurance.claims.application.port.out;

/**
 * Secondary (outbound) port: one in-flight submission per actor.
 * <p>
 * The guard is owned by a token (the attempt id). Only the owner can release
 * it, so a stale release from an earlier attempt never frees a newer one.
 * </p>
 */
public interface InFlightGuard {

    /**
     * Takes the guard for the actor if it is free.
     *
     * @param actorId submitter
     * @param token   owner token, the attempt id
     * @return true if acquired, false if another attempt holds it
     */
    boolean tryAcquire(String actorId, String token);

    /**
     * Frees the guard if it is held by the given token. No-op otherwise.
     *
     * @param actorId submitter
     * @param token   owner token used to acquire
     */
    void release(String actorId, String token);
}
