package com.insurance.claims.domain.exception;

/**
 * A submission was started while another attempt of the same actor is still in
 * flight. The running attempt is left untouched.
 */
public class ConcurrentSubmissionException extends ClaimSubmissionException {

    private final String actorId;

    public ConcurrentSubmissionException(String actorId) {
        super("A claim submission is already in progress for actor " + actorId);
        this.actorId = actorId;
    }

    public String getActorId() {
        return actorId;
    }
}
