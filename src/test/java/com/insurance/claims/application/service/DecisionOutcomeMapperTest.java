package com.insurance.claims.application.service;

import java.math.BigDecimal;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.insurance.claims.domain.entity.DecisionOutcome;
import com.insurance.claims.domain.entity.SubmissionAttempt;
import com.insurance.claims.domain.entity.SubmissionFailure;
import com.insurance.claims.domain.exception.ClaimValidationException;
import com.insurance.claims.domain.exception.DecisionServiceException;
import com.insurance.claims.domain.exception.MediaPipelineException;
import com.insurance.claims.domain.valueobject.FailureStage;
import com.insurance.claims.domain.valueobject.SubmissionEventType;
import com.insurance.claims.domain.valueobject.SubmissionState;
import com.insurance.claims.domain.valueobject.ValidationFailureReason;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DecisionOutcomeMapper Unit Tests")
class DecisionOutcomeMapperTest {

    private final DecisionOutcomeMapper mapper = new DecisionOutcomeMapper();

    private SubmissionAttempt submitting() {
        return SubmissionAttempt.start("actor-1", "claim-1")
                .transitionTo(SubmissionState.VALIDATING)
                .transitionTo(SubmissionState.UPLOADING_MEDIA)
                .transitionTo(SubmissionState.SUBMITTING);
    }

    @Nested
    @DisplayName("Decision outcomes")
    class Outcomes {

        @Test
        @DisplayName("Should approve with the payout and processing time")
        void shouldApprove() {
            DecisionOutcome outcome = DecisionOutcome.instantApproved("claim-1", new BigDecimal("1200.00"), 450);

            SubmissionAttempt result = mapper.applyOutcome(submitting(), outcome);

            assertThat(result.getState()).isEqualTo(SubmissionState.APPROVED);
            assertThat(result.getApprovalResult()).hasValueSatisfying(approval -> {
                assertThat(approval.getAmount()).isEqualByComparingTo("1200.00");
                assertThat(approval.getProcessingTimeMillis()).isEqualTo(450);
            });
        }

        @Test
        @DisplayName("Should map under review without approval terms")
        void shouldMapUnderReview() {
            SubmissionAttempt result = mapper.applyOutcome(submitting(),
                    DecisionOutcome.underReview("C-9912", "An adjuster will contact you"));

            assertThat(result.getState()).isEqualTo(SubmissionState.UNDER_REVIEW);
            assertThat(result.getApprovalResult()).isEmpty();
        }

        @Test
        @DisplayName("Should collapse flagged into rejected")
        void shouldCollapseFlagged() {
            SubmissionAttempt result = mapper.applyOutcome(submitting(),
                    DecisionOutcome.flagged("claim-1", "Call us"));

            assertThat(result.getState()).isEqualTo(SubmissionState.REJECTED);
            assertThat(result.getMessage()).contains("Call us");
        }

        @Test
        @DisplayName("Should fall back to a default message for a bare rejection")
        void shouldUseDefaultRejectionMessage() {
            SubmissionAttempt result = mapper.applyOutcome(submitting(), DecisionOutcome.rejected("claim-1", " "));

            assertThat(result.getMessage()).contains(DecisionOutcomeMapper.MSG_REJECTED_DEFAULT);
        }

        @Test
        @DisplayName("Should emit success and celebrate only for approvals")
        void shouldEmitPresentationEventsForApprovalOnly() {
            SubmissionAttempt approved = mapper.applyOutcome(submitting(),
                    DecisionOutcome.instantApproved("claim-1", BigDecimal.TEN, 10));
            SubmissionAttempt review = mapper.applyOutcome(submitting(),
                    DecisionOutcome.underReview("claim-1", null));

            assertThat(mapper.presentationEvents(approved))
                    .containsExactly(SubmissionEventType.SUBMISSION_SUCCEEDED, SubmissionEventType.CELEBRATE);
            assertThat(mapper.presentationEvents(review)).isEmpty();
        }

        @Test
        @DisplayName("Should not apply a decision to an attempt that is not submitting")
        void shouldRejectOutcomeOutsideSubmitting() {
            SubmissionAttempt validating = SubmissionAttempt.start("actor-1", "claim-1")
                    .transitionTo(SubmissionState.VALIDATING);

            assertThatThrownBy(() -> mapper.applyOutcome(validating, DecisionOutcome.underReview("c", null)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Failure attribution")
    class Failures {

        @Test
        @DisplayName("Should keep the media stage of a pipeline error")
        void shouldUseMediaStage() {
            SubmissionFailure failure = mapper.toFailure(
                    new CompletionException(new MediaPipelineException(FailureStage.MEDIA_UPLOAD, "S3 down")),
                    SubmissionState.UPLOADING_MEDIA);

            assertThat(failure.stage()).isEqualTo(FailureStage.MEDIA_UPLOAD);
            assertThat(failure.cause()).contains("S3 down");
            assertThat(failure.message()).isEqualTo(DecisionOutcomeMapper.MSG_SUBMISSION_FAILED);
        }

        @Test
        @DisplayName("Should surface the validation message for gate refusals")
        void shouldUseValidationMessage() {
            SubmissionFailure failure = mapper.toFailure(
                    new ClaimValidationException(ValidationFailureReason.AMOUNT_INVALID), SubmissionState.VALIDATING);

            assertThat(failure.stage()).isEqualTo(FailureStage.VALIDATION);
            assertThat(failure.message()).isEqualTo("Please enter a valid claim amount");
        }

        @Test
        @DisplayName("Should attribute Decision Service errors to the decision stage")
        void shouldAttributeDecisionErrors() {
            SubmissionFailure failure = mapper.toFailure(
                    new DecisionServiceException("timeout"), SubmissionState.SUBMITTING);

            assertThat(failure.stage()).isEqualTo(FailureStage.DECISION_SERVICE);
            assertThat(mapper.expectedStateFor(failure.stage())).isEqualTo(SubmissionState.SUBMITTING);
        }

        @Test
        @DisplayName("Should attribute untyped errors to the current stage")
        void shouldAttributeUntypedErrorsByState() {
            assertThat(mapper.toFailure(new RuntimeException("x"), SubmissionState.UPLOADING_MEDIA).stage())
                    .isEqualTo(FailureStage.MEDIA_UPLOAD);
            assertThat(mapper.toFailure(new RuntimeException("x"), SubmissionState.VALIDATING).stage())
                    .isEqualTo(FailureStage.VALIDATION);
        }
    }
}
