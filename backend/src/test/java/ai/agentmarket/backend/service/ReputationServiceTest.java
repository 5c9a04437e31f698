package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.dto.RateAgentRequest;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Rating;
import ai.agentmarket.backend.service.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static ai.agentmarket.backend.service.JobLedgerServiceImplTest.assertCode;
import static ai.agentmarket.backend.service.MarketplaceFixture.AGENT;
import static ai.agentmarket.backend.service.MarketplaceFixture.CLIENT;
import static ai.agentmarket.backend.service.MarketplaceFixture.STRANGER;
import static org.assertj.core.api.Assertions.assertThat;

class ReputationServiceTest {

    private MarketplaceFixture fx;
    private long jobId;

    @BeforeEach
    void setUp() {
        fx = new MarketplaceFixture();
        jobId = fx.jobInProgress("100", "90");
    }

    @Test
    void ratingRequiresCompletedJob() {
        assertCode(() -> rate(CLIENT, 5), ErrorCode.INVALID_STATE);
    }

    @Test
    void clientRatingUpdatesAgentAggregates() {
        fx.jobs.completeJob(AGENT, jobId);

        long ratingId = rate(CLIENT, 4);

        AgentProfile profile = fx.store.snapshot().agent("agent-1").orElseThrow();
        assertThat(profile.getTotalRatings()).isEqualTo(1);
        assertThat(profile.getTotalRatingPoints()).isEqualTo(4);
        assertThat(profile.getRating()).isEqualTo(4.0);
        Rating rating = fx.store.snapshot().rating(jobId, "client-1").orElseThrow();
        assertThat(rating.getId()).isEqualTo(ratingId);
        assertThat(rating.getRatee()).isEqualTo("agent-1");
    }

    @Test
    void agentMayRateClientWithoutProfile() {
        fx.jobs.completeJob(AGENT, jobId);

        rate(AGENT, 5);

        assertThat(fx.store.snapshot().rating(jobId, "agent-1").orElseThrow().getRatee()).isEqualTo("client-1");
        assertThat(fx.store.snapshot().agent("client-1")).isEmpty();
    }

    @Test
    void duplicateOutOfRangeAndOutsiderRatingsFail() {
        fx.jobs.completeJob(AGENT, jobId);

        assertCode(() -> rate(CLIENT, 0), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> rate(CLIENT, 6), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> rate(STRANGER, 3), ErrorCode.INVALID_STATE);
        rate(CLIENT, 3);
        assertCode(() -> rate(CLIENT, 3), ErrorCode.DUPLICATE_RATING);
        assertThat(fx.store.snapshot().agent("agent-1").orElseThrow().getTotalRatings()).isEqualTo(1);
    }

    private long rate(ai.agentmarket.backend.security.CallerIdentity rater, int score) {
        return fx.reputation.rateAgent(rater, jobId, RateAgentRequest.builder().rating(score).review("ok").build());
    }
}
