package com.insurance.claims.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.insurance.claims.application.port.in.SubmitClaimUseCase;
import com.insurance.claims.application.port.out.DecisionService;
import com.insurance.claims.application.port.out.InFlightGuard;
import com.insurance.claims.application.port.out.MediaPipeline;
import com.insurance.claims.application.port.out.StatusScheduler;
import com.insurance.claims.application.port.out.SubmissionEventListener;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.DecisionOutcome;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionFailure;
import com.insurance.claims.domain.exception.ClaimValidationException;
import com.insurance.claims.domain.exception.ConcurrentSubmissionException;
import com.insurance.claims.domain.exception.DecisionServiceException;
import com.insurance.claims.domain.exception.MediaPipelineException;
import com.insurance.claims.domain.valueobject.FailureStage;
import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionSettings;
import com.insurance.claims.domain.valueobject.SubmissionState;
import com.insurance.claims.domain.valueobject.ValidationFailureReason;
import com.insurance.claims.domain.valueobject.ValidationResult;

/**
 * Core use-case implementation: Claim Submission Orchestrator.
 * <p>
 * Drives one attempt through its stages, strictly in sequence:
 * <ol>
 * <li><b>Guard</b>: one in-flight attempt per actor</li>
 * <li><b>Gate</b>: amount, incident date, rate limit</li>
 * <li><b>Media</b>: compress, then upload, when evidence was captured</li>
 * <li><b>Decide</b>: Decision Service call, outcome mapped to a terminal state</li>
 * </ol>
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>Concurrent submission → thrown synchronously, running attempt untouched</li>
 * <li>Gate refusal → FAILED published, thrown synchronously</li>
 * <li>Media / Decision Service errors → FAILED with the stage, future completes
 * normally</li>
 * <li>Status scheduling errors → log + continue (state already applied)</li>
 * </ul>
 * Nothing is retried here; resubmitting a claim is the caller's decision.
 */
public class ClaimSubmissionOrchestrator implements SubmitClaimUseCase {

    private static final Logger log = LoggerFactory.getLogger(ClaimSubmissionOrchestrator.class);

    private final SubmissionGate submissionGate;
    private final MediaPipeline mediaPipeline;
    private final DecisionService decisionService;
    private final StatusScheduler statusScheduler;
    private final InFlightGuard inFlightGuard;
    private final DecisionOutcomeMapper outcomeMapper;
    private final SubmissionEventBus eventBus;
    private final SubmissionSettings settings;

    // Latest attempt per actor; finished ones are evicted after settings.attemptRetention()
    private final Map<String, SubmissionTracker> trackersByActor = new ConcurrentHashMap<>();

    /**
     * Constructor injection; all dependencies provided externally.
     */
    public ClaimSubmissionOrchestrator(SubmissionGate submissionGate,
            MediaPipeline mediaPipeline,
            DecisionService decisionService,
            StatusScheduler statusScheduler,
            InFlightGuard inFlightGuard,
            DecisionOutcomeMapper outcomeMapper,
            SubmissionEventBus eventBus,
            SubmissionSettings settings) {
        if (submissionGate == null)
            throw new IllegalArgumentException("submissionGate cannot be null");
        if (mediaPipeline == null)
            throw new IllegalArgumentException("mediaPipeline cannot be null");
        if (decisionService == null)
            throw new IllegalArgumentException("decisionService cannot be null");
        if (statusScheduler == null)
            throw new IllegalArgumentException("statusScheduler cannot be null");
        if (inFlightGuard == null)
            throw new IllegalArgumentException("inFlightGuard cannot be null");
        if (outcomeMapper == null)
            throw new IllegalArgumentException("outcomeMapper cannot be null");
        if (eventBus == null)
            throw new IllegalArgumentException("eventBus cannot be null");
        if (settings == null)
            throw new IllegalArgumentException("settings cannot be null");

        this.submissionGate = submissionGate;
        this.mediaPipeline = mediaPipeline;
        this.decisionService = decisionService;
        this.statusScheduler = statusScheduler;
        this.inFlightGuard = inFlightGuard;
        this.outcomeMapper = outcomeMapper;
        this.eventBus = eventBus;
        this.settings = settings;
    }

    @Override
    public CompletableFuture<SubmissionAttempt> submitClaim(ClaimRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        String actorId = request.getActorId();
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId cannot be null or blank");
        }

        Instant startTime = Instant.now();
        SubmissionAttempt initial = SubmissionAttempt.start(actorId, request.getClaimId());
        String token = initial.getAttemptId();

        // ── Step 0: IN-FLIGHT GUARD ──
        if (!inFlightGuard.tryAcquire(actorId, token)) {
            log.warn("action=concurrent_submission_rejected actorId={} claimId={}",
                    actorId, request.getClaimId());
            throw new ConcurrentSubmissionException(actorId);
        }

        SubmissionTracker tracker = new SubmissionTracker(initial, eventBus);
        trackersByActor.put(actorId, tracker);
        log.info("action=submission_start attemptId={} actorId={} claimId={} hasMedia={}",
                token, actorId, request.getClaimId(), request.hasLocalMedia());

        // ── Step 1: GATE ──
        try {
            runGate(tracker, request);
        } catch (RuntimeException e) {
            inFlightGuard.release(actorId, token);
            evictFinishedAttempts();
            throw e;
        }

        // ── Steps 2-5: MEDIA → DECIDE → MAP ──
        CompletableFuture<SubmissionAttempt> pipeline;
        try {
            tracker.advance(SubmissionState.VALIDATING, a -> a.transitionTo(SubmissionState.UPLOADING_MEDIA));
            pipeline = uploadEvidence(request)
                    .thenCompose(reference -> submitToDecisionService(tracker, request, reference))
                    .thenApply(outcome -> applyOutcome(tracker, outcome))
                    .exceptionally(error -> failAttempt(tracker, request, error));
        } catch (RuntimeException e) {
            pipeline = CompletableFuture.completedFuture(failAttempt(tracker, request, e));
        }

        return pipeline.whenComplete((attempt, error) -> {
            inFlightGuard.release(actorId, token);
            evictFinishedAttempts();
            long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
            if (error != null) {
                log.error("action=submission_error attemptId={} actorId={} error={}",
                        token, actorId, error.getMessage(), error);
            } else {
                log.info("action=submission_complete attemptId={} actorId={} claimId={} state={} latency={}ms",
                        token, actorId, request.getClaimId(), attempt.getState(), latencyMs);
            }
        });
    }

    @Override
    public Optional<SubmissionAttempt> currentAttempt(String actorId) {
        SubmissionTracker tracker = trackersByActor.get(actorId);
        return tracker != null ? Optional.of(tracker.current()) : Optional.empty();
    }

    @Override
    public void subscribe(SubmissionEventListener listener) {
        eventBus.subscribe(listener);
    }

    @Override
    public void unsubscribe(SubmissionEventListener listener) {
        eventBus.unsubscribe(listener);
    }

    // ─────────────────── Private Stages ───────────────────

    /**
     * Step 1: VALIDATING, then the gate. A refusal ends the attempt in FAILED
     * and is raised to the caller.
     */
    private void runGate(SubmissionTracker tracker, ClaimRequest request) {
        tracker.advance(SubmissionState.IDLE, a -> a.transitionTo(SubmissionState.VALIDATING));

        ValidationResult result;
        try {
            result = submissionGate.validate(request);
        } catch (RuntimeException e) {
            log.error("action=gate_error attemptId={} actorId={} error={}",
                    tracker.attemptId(), request.getActorId(), e.getMessage(), e);
            SubmissionFailure failure = outcomeMapper.toFailure(e, SubmissionState.VALIDATING);
            tracker.advance(SubmissionState.VALIDATING, a -> a.fail(failure));
            throw e;
        }

        if (!result.isPassed()) {
            ValidationFailureReason reason = result.getReason().orElseThrow();
            ClaimValidationException refusal = new ClaimValidationException(reason);
            SubmissionFailure failure = outcomeMapper.toFailure(refusal, SubmissionState.VALIDATING);
            tracker.advance(SubmissionState.VALIDATING, a -> a.fail(failure));
            throw refusal;
        }
    }

    /**
     * Step 2: compress then upload. Resolves to an empty reference when no
     * media was captured.
     */
    private CompletableFuture<String> uploadEvidence(ClaimRequest request) {
        if (!request.hasLocalMedia()) {
            log.info("action=media_skipped claimId={} reason=no_local_media", request.getClaimId());
            return CompletableFuture.completedFuture("");
        }

        String localReference = request.getLocalMediaReference();
        return attributed(
                () -> mediaPipeline.compress(localReference, settings.maxMediaBytes()),
                error -> asMediaFailure(FailureStage.MEDIA_COMPRESSION, error))
                .thenCompose(compressed -> {
                    log.info("action=media_compressed claimId={} compressed={}", request.getClaimId(), compressed);
                    return attributed(
                            () -> mediaPipeline.upload(compressed, settings.uploadDestination()),
                            error -> asMediaFailure(FailureStage.MEDIA_UPLOAD, error));
                });
    }

    /**
     * Steps 3-4: attach the evidence, SUBMITTING, Decision Service call.
     * Package-private for tests.
     */
    CompletableFuture<DecisionOutcome> submitToDecisionService(SubmissionTracker tracker,
            ClaimRequest request, String evidenceReference) {
        request.attachMediaEvidence(evidenceReference);
        if (request.getMediaEvidenceReference() != null) {
            log.info("action=media_uploaded claimId={} evidence={}",
                    request.getClaimId(), request.getMediaEvidenceReference());
        }

        if (!tracker.advance(SubmissionState.UPLOADING_MEDIA, a -> a.transitionTo(SubmissionState.SUBMITTING))) {
            throw new IllegalStateException("Attempt " + tracker.attemptId() + " is no longer uploading media");
        }

        return attributed(
                () -> decisionService.submit(request),
                error -> error instanceof DecisionServiceException
                        ? (DecisionServiceException) error
                        : new DecisionServiceException("Decision Service call failed: " + error.getMessage(), error));
    }

    /**
     * Step 5: terminal state first, then the side-channel work.
     */
    private SubmissionAttempt applyOutcome(SubmissionTracker tracker, DecisionOutcome outcome) {
        log.info("action=decision_received attemptId={} claimId={} status={}",
                tracker.attemptId(), outcome.getClaimId(), outcome.getStatus());

        if (!tracker.advance(SubmissionState.SUBMITTING, a -> outcomeMapper.applyOutcome(a, outcome))) {
            return tracker.current();
        }

        SubmissionAttempt decided = tracker.current();
        for (SubmissionEventType type : outcomeMapper.presentationEvents(decided)) {
            tracker.publish(type);
        }
        if (decided.getState() == SubmissionState.UNDER_REVIEW) {
            scheduleStatusUpdates(outcome.getClaimId());
        }
        return decided;
    }

    /**
     * Step 6: FAILED with the failing stage, applied only if the attempt is
     * still in that stage.
     */
    private SubmissionAttempt failAttempt(SubmissionTracker tracker, ClaimRequest request, Throwable error) {
        SubmissionAttempt current = tracker.current();
        SubmissionFailure failure = outcomeMapper.toFailure(error, current.getState());

        log.error("action=stage_failed attemptId={} actorId={} stage={} cause={}",
                current.getAttemptId(), current.getActorId(), failure.stage(), failure.cause(),
                DecisionOutcomeMapper.unwrap(error));

        SubmissionState expected = outcomeMapper.expectedStateFor(failure.stage());
        if (!tracker.advance(expected, a -> a.fail(failure))) {
            log.warn("action=late_failure_ignored attemptId={} stage={} state={}",
                    current.getAttemptId(), failure.stage(), tracker.current().getState());
        }

        if (failure.stage() == FailureStage.DECISION_SERVICE && request.getMediaEvidenceReference() != null) {
            // Uploaded artifact is left to the storage lifecycle
            log.warn("action=orphaned_evidence attemptId={} claimId={} evidence={}",
                    current.getAttemptId(), request.getClaimId(), request.getMediaEvidenceReference());
        }
        return tracker.current();
    }

    /**
     * Fire-and-forget subscription for claims under review.
     */
    private void scheduleStatusUpdates(String claimId) {
        try {
            statusScheduler.scheduleUpdates(claimId);
            log.info("action=status_updates_scheduled claimId={}", claimId);
        } catch (Exception e) {
            log.error("action=status_schedule_error claimId={} error={}", claimId, e.getMessage(), e);
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    /**
     * Drops trackers whose attempt reached a terminal state longer ago than the
     * retention. Removal is value-checked, so a tracker replaced by a newer
     * attempt meanwhile is kept.
     */
    private void evictFinishedAttempts() {
        Instant cutoff = Instant.now().minus(settings.attemptRetention());
        int before = trackersByActor.size();
        trackersByActor.entrySet().removeIf(entry -> {
            SubmissionAttempt attempt = entry.getValue().current();
            return attempt.getState().isTerminal() && !attempt.getUpdatedAt().isAfter(cutoff);
        });
        int evicted = before - trackersByActor.size();
        if (evicted > 0) {
            log.debug("action=attempts_evicted count={} tracked={}", evicted, trackersByActor.size());
        }
    }

    /**
     * Runs a collaborator call and maps any failure, synchronous or not, to
     * the stage's typed error.
     */
    private static <T> CompletableFuture<T> attributed(Supplier<CompletableFuture<T>> call,
            Function<Throwable, RuntimeException> toStageError) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            future = CompletableFuture.failedFuture(new IllegalStateException("collaborator returned no result"));
        }
        return future.handle((value, error) -> {
            if (error != null) {
                throw toStageError.apply(DecisionOutcomeMapper.unwrap(error));
            }
            return value;
        });
    }

    private static MediaPipelineException asMediaFailure(FailureStage stage, Throwable error) {
        if (error instanceof MediaPipelineException && ((MediaPipelineException) error).getStage() == stage) {
            return (MediaPipelineException) error;
        }
        String verb = stage == FailureStage.MEDIA_COMPRESSION ? "compression" : "upload";
        return new MediaPipelineException(stage, "Media " + verb + " failed: " + error.getMessage(), error);
    }
}
