package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.DisputeResponseRequest;
import ai.agentmarket.backend.model.dto.OpenDisputeRequest;
import ai.agentmarket.backend.model.dto.ResolveDisputeRequest;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.DisputeStatus;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.SequenceGenerator;
import ai.agentmarket.backend.util.Inputs;
import ai.agentmarket.backend.util.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Disputes between the client and the assigned agent of an in-progress job, settled by a
 * dispute admin.
 */
@Slf4j
@Service
public class DisputeService {

    static final String DISPUTE_SEQUENCE = "dispute";

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final SequenceGenerator sequenceGenerator;
    private final EscrowManager escrowManager;
    private final Clock clock;

    public DisputeService(LedgerStore ledgerStore, LedgerCommitter committer, SequenceGenerator sequenceGenerator,
                          EscrowManager escrowManager, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.sequenceGenerator = sequenceGenerator;
        this.escrowManager = escrowManager;
        this.clock = clock;
    }

    /**
     * Opens a dispute and moves the job to DISPUTED.
     *
     * @return the dispute id
     */
    public long openDispute(CallerIdentity caller, long jobId, OpenDisputeRequest request) {
        String reason = Inputs.requireText(request.getReason(), "Reason");
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        boolean isClient = job.isClient(caller.getId());
        if (!isClient && !job.isAssignedAgent(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client or the assigned agent can dispute job " + jobId);
        }
        boolean unresolvedExists = ledgerStore.disputes(jobId).stream()
                .anyMatch(d -> !d.getStatus().isResolved());
        if (unresolvedExists) {
            throw MarketplaceException.invalidState("Job " + jobId + " already has an unresolved dispute");
        }
        JobLedgerServiceImpl.requireStatus(job, JobStatus.IN_PROGRESS);

        Instant now = clock.instant();
        long disputeId = sequenceGenerator.next(DISPUTE_SEQUENCE);
        String respondent = isClient ? job.getAgent() : job.getClient();
        Dispute dispute = Dispute.builder()
                .id(disputeId)
                .jobId(jobId)
                .initiator(caller.getId())
                .respondent(respondent)
                .reason(reason)
                .status(DisputeStatus.OPEN)
                .createdAt(now)
                .build();
        job.setStatus(JobStatus.DISPUTED);
        job.setUpdatedAt(now);

        committer.commit("open_dispute", new LedgerTransaction()
                .save(job)
                .save(dispute)
                .publish(MarketplaceEvent.of(MarketplaceEventType.DISPUTE_OPENED, jobId, caller.getId(), respondent, null, now)));

        log.info("Dispute {} opened on job {} by {}: {}", disputeId, jobId, caller.getId(),
                SecurityUtils.sanitizeForLogging(reason));
        return disputeId;
    }

    /**
     * Records the other party's answer. OPEN -> RESPONDED.
     *
     * @return the dispute id
     */
    public long respondToDispute(CallerIdentity caller, long disputeId, DisputeResponseRequest request) {
        Dispute dispute = requireDispute(disputeId);
        if (!caller.is(dispute.getRespondent())) {
            throw MarketplaceException.unauthorized("Only the other party can respond to dispute " + disputeId);
        }
        requireUnresolved(dispute);
        if (dispute.getStatus() != DisputeStatus.OPEN) {
            throw MarketplaceException.invalidState("Dispute " + disputeId + " was already answered");
        }
        String response = Inputs.requireText(request.getResponse(), "Response");

        Instant now = clock.instant();
        dispute.setResponse(response);
        dispute.setRespondedAt(now);
        dispute.setStatus(DisputeStatus.RESPONDED);

        committer.commit("respond_to_dispute", new LedgerTransaction()
                .save(dispute)
                .publish(MarketplaceEvent.of(MarketplaceEventType.DISPUTE_RESPONDED, dispute.getJobId(), caller.getId(),
                        dispute.getInitiator(), null, now)));
        log.info("Dispute {} answered by {}", disputeId, caller.getId());
        return disputeId;
    }

    /**
     * Settles a dispute and its escrow.
     * For the client: refund the balance, job CANCELLED. For the agent: release the balance, job COMPLETED.
     * Split: refund the given percentage of the balance (rounded down), release the rest, job COMPLETED.
     *
     * @return the dispute id
     */
    public long resolveDispute(CallerIdentity caller, long disputeId, ResolveDisputeRequest request) {
        if (!caller.isAdmin()) {
            throw MarketplaceException.unauthorized("Only dispute admins can resolve disputes");
        }
        Dispute dispute = requireDispute(disputeId);
        requireUnresolved(dispute);

        DisputeStatus resolution = request.getResolution();
        if (resolution == null || !resolution.isResolved()) {
            throw MarketplaceException.invalidArgument("Resolution must be one of the RESOLVED_* statuses");
        }
        Integer refundPercentage = request.getRefundPercentage();
        if (resolution == DisputeStatus.RESOLVED_SPLIT
                && (refundPercentage == null || refundPercentage < 0 || refundPercentage > 100)) {
            throw MarketplaceException.invalidAmount("Split resolutions need a refund percentage between 0 and 100");
        }

        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, dispute.getJobId());
        JobLedgerServiceImpl.requireStatus(job, JobStatus.DISPUTED);
        EscrowRecord escrow = JobLedgerServiceImpl.requireEscrow(ledgerStore, job.getId());
        String agent = job.getAgent();

        Instant now = clock.instant();
        BigDecimal refunded = BigDecimal.ZERO;
        BigDecimal released = BigDecimal.ZERO;
        switch (resolution) {
            case RESOLVED_FOR_CLIENT -> {
                refunded = escrowManager.refundRemaining(escrow, now);
                job.setStatus(JobStatus.CANCELLED);
                job.setAgent(null);
            }
            case RESOLVED_FOR_AGENT -> {
                released = escrowManager.releaseRemaining(escrow, now);
                job.setStatus(JobStatus.COMPLETED);
                job.setCompletedAt(now);
            }
            default -> {
                BigDecimal[] parts = escrowManager.split(escrow, refundPercentage, now);
                refunded = parts[0];
                released = parts[1];
                job.setStatus(JobStatus.COMPLETED);
                job.setCompletedAt(now);
            }
        }
        job.setUpdatedAt(now);

        dispute.setStatus(resolution);
        dispute.setResolvedAt(now);
        dispute.setResolvedBy(caller.getId());
        dispute.setResolutionNotes(Inputs.optionalText(request.getNotes()));
        dispute.setRefundPercentage(resolution == DisputeStatus.RESOLVED_SPLIT ? refundPercentage : null);
        dispute.setRefundedAmount(refunded);
        dispute.setReleasedAmount(released);

        LedgerTransaction transaction = new LedgerTransaction()
                .save(job)
                .save(dispute)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.DISPUTE_RESOLVED, job.getId(), caller.getId(),
                        dispute.getInitiator(), null, now));
        if (job.getStatus() == JobStatus.COMPLETED) {
            ledgerStore.agent(agent).ifPresent(profile -> {
                profile.setJobsCompleted(profile.getJobsCompleted() + 1);
                transaction.save(profile);
            });
        }
        if (refunded.signum() > 0) {
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_REFUNDED, job.getId(), caller.getId(), job.getClient(), refunded, now));
        }
        if (released.signum() > 0) {
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_RELEASED, job.getId(), caller.getId(), agent, released, now));
        }
        committer.commit("resolve_dispute", transaction);

        log.info("Dispute {} resolved as {} by {} (refunded {}, released {})", disputeId, resolution, caller.getId(),
                refunded.toPlainString(), released.toPlainString());
        return disputeId;
    }

    private Dispute requireDispute(long disputeId) {
        return ledgerStore.dispute(disputeId).orElseThrow(() -> MarketplaceException.notFound("Dispute", disputeId));
    }

    private void requireUnresolved(Dispute dispute) {
        if (dispute.getStatus().isResolved()) {
            throw new MarketplaceException(ErrorCode.ALREADY_RESOLVED, "Dispute " + dispute.getId() + " is already resolved");
        }
    }
}
