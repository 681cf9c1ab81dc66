package com.insurance.claims.adapters.out.http;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.insurance.claims.bootstrap.config.ClaimsProperties;
import com.insurance.claims.domain.entity.ClaimRequest;
import com.insurance.claims.domain.entity.DecisionOutcome;
import com.insurance.claims.domain.exception.DecisionServiceException;
import com.insurance.claims.domain.valueobject.ClaimType;
import com.insurance.claims.domain.valueobject.DecisionStatus;
import com.insurance.claims.domain.valueobject.IncidentLocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("HttpDecisionService Unit Tests")
class HttpDecisionServiceTest {

    private static final String URL = "http://decision.test/v1/claims";

    private MockRestServiceServer server;
    private HttpDecisionService decisionService;
    private ClaimRequest claim;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        ClaimsProperties properties = new ClaimsProperties();
        properties.getDecision().setBaseUrl("http://decision.test/");
        decisionService = new HttpDecisionService(restTemplate, Runnable::run, properties);

        claim = new ClaimRequest("user-7", new BigDecimal("1500.00"), Instant.parse("2024-05-30T10:00:00Z"));
        claim.setClaimId("C-100");
        claim.setPolicyId("P-1");
        claim.setClaimType(ClaimType.WATER_DAMAGE);
        claim.attachMediaEvidence("s3://bucket/evidence123");
    }

    @Test
    @DisplayName("Should post a snake_case claim and map an instant approval")
    void shouldMapInstantApproval() {
        // Given
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.claim_id").value("C-100"))
                .andExpect(jsonPath("$.user_id").value("user-7"))
                .andExpect(jsonPath("$.claim_type").value("water_damage"))
                .andExpect(jsonPath("$.video_evidence_url").value("s3://bucket/evidence123"))
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"instant_approved\","
                        + "\"payout_amount\":1200.00,\"processing_time_ms\":450,\"extra\":true}",
                        MediaType.APPLICATION_JSON));

        // When
        DecisionOutcome outcome = decisionService.submit(claim).join();

        // Then
        assertThat(outcome.getStatus()).isEqualTo(DecisionStatus.INSTANT_APPROVED);
        assertThat(outcome.getPayoutAmount()).hasValueSatisfying(
                amount -> assertThat(amount).isEqualByComparingTo("1200.00"));
        assertThat(outcome.getProcessingTimeMillis()).contains(450L);
        server.verify();
    }

    @Test
    @DisplayName("Should send the incident location and photo references")
    void shouldSendLocationAndPhotos() {
        // Given
        claim.setDescription("Pipe burst in the kitchen");
        claim.setLocation(new IncidentLocation(40.7128, -74.0060));
        claim.setPhotoReferences(List.of("s3://bucket/photo-1.jpg", "s3://bucket/photo-2.jpg"));
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.policy_id").value("P-1"))
                .andExpect(jsonPath("$.description").value("Pipe burst in the kitchen"))
                .andExpect(jsonPath("$.estimated_amount").value(1500.00))
                .andExpect(jsonPath("$.location.lat").value(40.7128))
                .andExpect(jsonPath("$.location.lng").value(-74.0060))
                .andExpect(jsonPath("$.photos.length()").value(2))
                .andExpect(jsonPath("$.photos[0]").value("s3://bucket/photo-1.jpg"))
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"under_review\"}",
                        MediaType.APPLICATION_JSON));

        // When
        DecisionOutcome outcome = decisionService.call(claim);

        // Then
        assertThat(outcome.getStatus()).isEqualTo(DecisionStatus.UNDER_REVIEW);
        server.verify();
    }

    @Test
    @DisplayName("Should send an empty photo list when no photos were attached")
    void shouldSendEmptyPhotos() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.photos").isArray())
                .andExpect(jsonPath("$.photos").isEmpty())
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"under_review\"}",
                        MediaType.APPLICATION_JSON));

        decisionService.call(claim);

        server.verify();
    }

    @Test
    @DisplayName("Should map a flagged decision with next steps")
    void shouldMapFlagged() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"flagged\","
                        + "\"next_steps\":\"Contact support\"}", MediaType.APPLICATION_JSON));

        DecisionOutcome outcome = decisionService.call(claim);

        assertThat(outcome.getStatus()).isEqualTo(DecisionStatus.FLAGGED);
        assertThat(outcome.getNextSteps()).isEqualTo("Contact support");
    }

    @Test
    @DisplayName("Should raise a DecisionServiceException carrying the HTTP status")
    void shouldRaiseOnServerError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> decisionService.call(claim))
                .isInstanceOfSatisfying(DecisionServiceException.class,
                        e -> assertThat(e.getHttpStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    @Test
    @DisplayName("Should treat an unknown status as a malformed response")
    void shouldRejectUnknownStatus() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"maybe\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> decisionService.call(claim))
                .isInstanceOf(DecisionServiceException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should treat an approval without payout as a malformed response")
    void shouldRejectApprovalWithoutPayout() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"claim_id\":\"C-100\",\"status\":\"instant_approved\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> decisionService.call(claim))
                .isInstanceOf(DecisionServiceException.class);
    }
}
