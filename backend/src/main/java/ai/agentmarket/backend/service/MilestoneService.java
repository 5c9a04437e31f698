package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.MilestoneSubmissionRequest;
import ai.agentmarket.backend.model.dto.RevisionRequest;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Milestone;
import ai.agentmarket.backend.model.entity.MilestoneStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.util.Amounts;
import ai.agentmarket.backend.util.Inputs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Milestone workflow on in-progress jobs.
 *
 * PENDING -> SUBMITTED -> APPROVED, or SUBMITTED -> REVISION_REQUESTED -> SUBMITTED.
 * Approval immediately releases the milestone's share of the accepted bid from escrow.
 */
@Slf4j
@Service
public class MilestoneService {

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final EscrowManager escrowManager;
    private final Clock clock;

    public MilestoneService(LedgerStore ledgerStore, LedgerCommitter committer, EscrowManager escrowManager, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.escrowManager = escrowManager;
        this.clock = clock;
    }

    public long submitMilestone(CallerIdentity caller, long jobId, long milestoneId, MilestoneSubmissionRequest request) {
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!job.isAssignedAgent(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the assigned agent can submit milestones of job " + jobId);
        }
        JobLedgerServiceImpl.requireStatus(job, JobStatus.IN_PROGRESS);
        Milestone milestone = requireMilestone(job, milestoneId);
        if (!milestone.getStatus().isSubmittable()) {
            throw MarketplaceException.invalidState("Milestone " + milestoneId + " is " + milestone.getStatus());
        }

        Instant now = clock.instant();
        milestone.setStatus(MilestoneStatus.SUBMITTED);
        milestone.setSubmissionNotes(Inputs.optionalText(request.getNotes()));
        milestone.setSubmittedAt(now);
        job.setUpdatedAt(now);

        committer.commit("submit_milestone", new LedgerTransaction()
                .save(job)
                .publish(MarketplaceEvent.of(MarketplaceEventType.MILESTONE_SUBMITTED, jobId, caller.getId(), job.getClient(), null, now)));
        log.info("Milestone {} of job {} submitted", milestoneId, jobId);
        return milestoneId;
    }

    public long approveMilestone(CallerIdentity caller, long jobId, long milestoneId) {
        Job job = requireClientJob(caller, jobId);
        Milestone milestone = requireSubmitted(job, milestoneId);
        EscrowRecord escrow = JobLedgerServiceImpl.requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        // Share of the accepted bid, capped at what is still held if the client released funds manually
        BigDecimal share = Amounts.percentOf(job.getAcceptedBidAmount(), milestone.getPaymentPercentage());
        BigDecimal released = share.min(escrow.getBalance());
        if (released.signum() > 0) {
            escrowManager.release(escrow, released, now);
        }

        milestone.setStatus(MilestoneStatus.APPROVED);
        milestone.setApprovedAt(now);
        milestone.setReleasedAmount(released);
        job.setUpdatedAt(now);

        LedgerTransaction transaction = new LedgerTransaction()
                .save(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.MILESTONE_APPROVED, jobId, caller.getId(), job.getAgent(), null, now));
        if (released.signum() > 0) {
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_RELEASED, jobId, caller.getId(), job.getAgent(), released, now));
        }
        committer.commit("approve_milestone", transaction);

        log.info("Milestone {} of job {} approved, released {}", milestoneId, jobId, released.toPlainString());
        return milestoneId;
    }

    public long requestRevision(CallerIdentity caller, long jobId, long milestoneId, RevisionRequest request) {
        Job job = requireClientJob(caller, jobId);
        Milestone milestone = requireSubmitted(job, milestoneId);

        Instant now = clock.instant();
        milestone.setStatus(MilestoneStatus.REVISION_REQUESTED);
        milestone.setRevisionFeedback(Inputs.optionalText(request.getFeedback()));
        job.setUpdatedAt(now);

        committer.commit("request_revision", new LedgerTransaction()
                .save(job)
                .publish(MarketplaceEvent.of(MarketplaceEventType.REVISION_REQUESTED, jobId, caller.getId(), job.getAgent(), null, now)));
        log.info("Revision requested for milestone {} of job {}", milestoneId, jobId);
        return milestoneId;
    }

    private Job requireClientJob(CallerIdentity caller, long jobId) {
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client can review milestones of job " + jobId);
        }
        JobLedgerServiceImpl.requireStatus(job, JobStatus.IN_PROGRESS);
        return job;
    }

    private Milestone requireSubmitted(Job job, long milestoneId) {
        Milestone milestone = requireMilestone(job, milestoneId);
        if (milestone.getStatus() != MilestoneStatus.SUBMITTED) {
            throw MarketplaceException.invalidState("Milestone " + milestoneId + " is " + milestone.getStatus());
        }
        return milestone;
    }

    private Milestone requireMilestone(Job job, long milestoneId) {
        return job.findMilestone(milestoneId)
                .orElseThrow(() -> MarketplaceException.notFound("Milestone", milestoneId + " of job " + job.getId()));
    }
}
