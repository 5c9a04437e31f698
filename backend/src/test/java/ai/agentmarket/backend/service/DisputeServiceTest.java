package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.dto.DisputeResponseRequest;
import ai.agentmarket.backend.model.dto.OpenDisputeRequest;
import ai.agentmarket.backend.model.dto.ResolveDisputeRequest;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.DisputeStatus;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.EscrowStatus;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.store.LedgerSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static ai.agentmarket.backend.service.JobLedgerServiceImplTest.assertCode;
import static ai.agentmarket.backend.service.MarketplaceFixture.ADMIN;
import static ai.agentmarket.backend.service.MarketplaceFixture.AGENT;
import static ai.agentmarket.backend.service.MarketplaceFixture.CLIENT;
import static ai.agentmarket.backend.service.MarketplaceFixture.STRANGER;
import static org.assertj.core.api.Assertions.assertThat;

class DisputeServiceTest {

    private MarketplaceFixture fx;
    private long jobId;

    @BeforeEach
    void setUp() {
        fx = new MarketplaceFixture();
        jobId = fx.jobInProgress("100", "90");
    }

    @Test
    @DisplayName("Split 50% of a 90 escrow refunds 45 and releases 45")
    void splitResolution() {
        // Given
        long disputeId = open(CLIENT);

        // When
        fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_SPLIT)
                .refundPercentage(50)
                .notes("both partly right")
                .build());

        // Then
        LedgerSnapshot snapshot = fx.store.snapshot();
        EscrowRecord escrow = snapshot.escrow(jobId).orElseThrow();
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("45");
        assertThat(escrow.getReleasedAmount()).isEqualByComparingTo("45");
        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.RELEASED);

        Dispute dispute = snapshot.dispute(disputeId).orElseThrow();
        assertThat(dispute.getStatus()).isEqualTo(DisputeStatus.RESOLVED_SPLIT);
        assertThat(dispute.getResolvedBy()).isEqualTo("admin-1");
        assertThat(dispute.getRefundPercentage()).isEqualTo(50);
        assertThat(snapshot.job(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snapshot.agent("agent-1").orElseThrow().getJobsCompleted()).isEqualTo(1);
    }

    @Test
    void resolvedForClientRefundsAndCancels() {
        long disputeId = open(AGENT);

        fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_FOR_CLIENT).build());

        LedgerSnapshot snapshot = fx.store.snapshot();
        Job job = snapshot.job(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.getAgent()).isNull();
        EscrowRecord escrow = snapshot.escrow(jobId).orElseThrow();
        assertThat(escrow.getStatus()).isEqualTo(EscrowStatus.REFUNDED);
        assertThat(escrow.getRefundedAmount()).isEqualByComparingTo("90");
        assertThat(snapshot.agent("agent-1").orElseThrow().getJobsCompleted()).isZero();
    }

    @Test
    void resolvedForAgentReleasesAndCompletes() {
        long disputeId = open(CLIENT);

        fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_FOR_AGENT).build());

        LedgerSnapshot snapshot = fx.store.snapshot();
        assertThat(snapshot.job(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(snapshot.escrow(jobId).orElseThrow().getReleasedAmount()).isEqualByComparingTo("90");
    }

    @Test
    void openingMovesJobToDisputedAndSetsRespondent() {
        long disputeId = open(CLIENT);

        Dispute dispute = fx.store.snapshot().dispute(disputeId).orElseThrow();
        assertThat(dispute.getStatus()).isEqualTo(DisputeStatus.OPEN);
        assertThat(dispute.getRespondent()).isEqualTo("agent-1");
        assertThat(fx.store.snapshot().job(jobId).orElseThrow().getStatus()).isEqualTo(JobStatus.DISPUTED);
        assertCode(() -> open(AGENT), ErrorCode.INVALID_STATE);
    }

    @Test
    void openRequiresParticipantAndReason() {
        assertCode(() -> open(STRANGER), ErrorCode.UNAUTHORIZED);
        assertCode(() -> fx.disputes.openDispute(CLIENT, jobId, OpenDisputeRequest.builder().reason(" ").build()),
                ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fx.disputes.openDispute(CLIENT, 404, OpenDisputeRequest.builder().reason("x").build()),
                ErrorCode.NOT_FOUND);
    }

    @Test
    void openOnPostedJobFails() {
        long posted = fx.postJob("10");

        assertCode(() -> fx.disputes.openDispute(CLIENT, posted, OpenDisputeRequest.builder().reason("x").build()),
                ErrorCode.INVALID_STATE);
    }

    @Test
    void respondOnlyByRespondentAndOnce() {
        long disputeId = open(CLIENT);
        DisputeResponseRequest response = DisputeResponseRequest.builder().response("work was delivered").build();

        assertCode(() -> fx.disputes.respondToDispute(CLIENT, disputeId, response), ErrorCode.UNAUTHORIZED);
        fx.disputes.respondToDispute(AGENT, disputeId, response);
        assertThat(fx.store.snapshot().dispute(disputeId).orElseThrow().getStatus()).isEqualTo(DisputeStatus.RESPONDED);
        assertCode(() -> fx.disputes.respondToDispute(AGENT, disputeId, response), ErrorCode.INVALID_STATE);
    }

    @Test
    void resolveChecks() {
        long disputeId = open(CLIENT);

        assertCode(() -> fx.disputes.resolveDispute(CLIENT, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_FOR_CLIENT).build()), ErrorCode.UNAUTHORIZED);
        assertCode(() -> fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESPONDED).build()), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_SPLIT).refundPercentage(101).build()), ErrorCode.INVALID_AMOUNT);

        fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_FOR_AGENT).build());
        assertCode(() -> fx.disputes.resolveDispute(ADMIN, disputeId, ResolveDisputeRequest.builder()
                .resolution(DisputeStatus.RESOLVED_FOR_CLIENT).build()), ErrorCode.ALREADY_RESOLVED);
        assertCode(() -> fx.disputes.respondToDispute(AGENT, disputeId,
                DisputeResponseRequest.builder().response("late").build()), ErrorCode.ALREADY_RESOLVED);
    }

    private long open(ai.agentmarket.backend.security.CallerIdentity caller) {
        return fx.disputes.openDispute(caller, jobId, OpenDisputeRequest.builder().reason("not delivered").build());
    }
}
