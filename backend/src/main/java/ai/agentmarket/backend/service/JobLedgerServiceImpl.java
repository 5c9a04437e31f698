package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.AcceptBidRequest;
import ai.agentmarket.backend.model.dto.MilestoneRequest;
import ai.agentmarket.backend.model.dto.PlaceBidRequest;
import ai.agentmarket.backend.model.dto.PostJobRequest;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.EscrowStatus;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Milestone;
import ai.agentmarket.backend.model.entity.MilestoneStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerView;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.SequenceGenerator;
import ai.agentmarket.backend.util.Amounts;
import ai.agentmarket.backend.util.Inputs;
import ai.agentmarket.backend.util.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class JobLedgerServiceImpl implements JobLedgerService {

    static final String JOB_SEQUENCE = "job";

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final SequenceGenerator sequenceGenerator;
    private final EscrowManager escrowManager;
    private final Clock clock;

    @Autowired
    public JobLedgerServiceImpl(LedgerStore ledgerStore, LedgerCommitter committer, SequenceGenerator sequenceGenerator,
                                EscrowManager escrowManager, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.sequenceGenerator = sequenceGenerator;
        this.escrowManager = escrowManager;
        this.clock = clock;
    }

    @Override
    public long postJob(CallerIdentity caller, PostJobRequest request) {
        Instant now = clock.instant();
        String title = Inputs.requireText(request.getTitle(), "Title");
        String description = Inputs.requireText(request.getDescription(), "Description");
        BigDecimal payment = Amounts.parsePositive(request.getPayment(), "Payment");
        if (request.getCategory() == null) {
            throw MarketplaceException.invalidArgument("Category is required");
        }
        if (request.getDeadline() != null && request.getDeadline().isBefore(now)) {
            throw MarketplaceException.invalidArgument("Deadline is in the past");
        }
        List<Milestone> milestones = buildMilestones(request.getMilestones());

        long jobId = sequenceGenerator.next(JOB_SEQUENCE);
        Job job = Job.builder()
                .id(jobId)
                .client(caller.getId())
                .title(title)
                .description(description)
                .payment(payment)
                .status(JobStatus.POSTED)
                .category(request.getCategory())
                .tags(Inputs.distinctTokens(request.getTags()))
                .deadline(request.getDeadline())
                .milestones(milestones)
                .escrowId(jobId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        EscrowRecord escrow = EscrowRecord.builder()
                .escrowId(jobId)
                .jobId(jobId)
                .client(caller.getId())
                .status(EscrowStatus.UNFUNDED)
                .createdAt(now)
                .build();

        committer.commit("post_job", new LedgerTransaction()
                .save(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.JOB_POSTED, jobId, caller.getId(), null, payment, now)));

        log.info("Job {} posted by {} ('{}', payment {})", jobId, caller.getId(),
                SecurityUtils.sanitizeForLogging(title), payment.toPlainString());
        return jobId;
    }

    @Override
    public long placeBid(CallerIdentity caller, long jobId, PlaceBidRequest request) {
        BigDecimal amount = Amounts.parsePositive(request.getAmount(), "Bid amount");
        String proposal = Inputs.requireText(request.getProposal(), "Proposal");
        if (request.getEstimatedDays() == null || request.getEstimatedDays() <= 0) {
            throw MarketplaceException.invalidArgument("Estimated days must be greater than zero");
        }

        if (ledgerStore.agent(caller.getId()).isEmpty()) {
            throw MarketplaceException.unauthorized("Only registered agents can bid");
        }
        Job job = requireJob(ledgerStore, jobId);
        if (job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Clients cannot bid on their own job");
        }
        requireStatus(job, JobStatus.POSTED);
        if (ledgerStore.bid(jobId, caller.getId()).isPresent()) {
            throw new MarketplaceException(ErrorCode.DUPLICATE_BID, "Agent " + caller.getId() + " already bid on job " + jobId);
        }

        Instant now = clock.instant();
        long bidId = sequenceGenerator.next("bid:" + jobId);
        Bid bid = Bid.builder()
                .jobId(jobId)
                .bidId(bidId)
                .agent(caller.getId())
                .amount(amount)
                .proposal(proposal)
                .estimatedDays(request.getEstimatedDays())
                .timestamp(now)
                .build();

        // Bids only guard the job, so bids from different agents never conflict
        committer.commit("place_bid", new LedgerTransaction()
                .guard(job)
                .save(bid)
                .publish(MarketplaceEvent.of(MarketplaceEventType.BID_PLACED, jobId, caller.getId(), job.getClient(), amount, now)));

        log.info("Bid {} placed on job {} by {} for {}", bidId, jobId, caller.getId(), amount.toPlainString());
        return bidId;
    }

    @Override
    public long acceptBid(CallerIdentity caller, long jobId, AcceptBidRequest request) {
        Job job = requireJob(ledgerStore, jobId);
        if (!job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client can accept bids on job " + jobId);
        }
        requireStatus(job, JobStatus.POSTED);

        String agent = Inputs.requireText(request.getAgent(), "Agent");
        BigDecimal bidAmount = Amounts.parsePositive(request.getBidAmount(), "Bid amount");
        Bid bid = ledgerStore.bid(jobId, agent)
                .filter(b -> b.getAmount().compareTo(bidAmount) == 0)
                .orElseThrow(() -> new MarketplaceException(ErrorCode.BID_NOT_FOUND,
                        "No bid from " + agent + " of " + bidAmount.toPlainString() + " on job " + jobId));
        EscrowRecord escrow = requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        BigDecimal surplus = escrowManager.lockForAcceptance(escrow, bid.getAgent(), bid.getAmount(), now);
        job.setAgent(bid.getAgent());
        job.setAcceptedBidAmount(bid.getAmount());
        job.setStatus(JobStatus.IN_PROGRESS);
        job.setUpdatedAt(now);

        LedgerTransaction transaction = new LedgerTransaction()
                .save(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.BID_ACCEPTED, jobId, caller.getId(), bid.getAgent(), bid.getAmount(), now));
        if (surplus.signum() > 0) {
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_REFUNDED, jobId, caller.getId(), caller.getId(), surplus, now));
        }
        committer.commit("accept_bid", transaction);

        log.info("Job {} assigned to {} at {}", jobId, bid.getAgent(), bid.getAmount().toPlainString());
        return jobId;
    }

    @Override
    public long completeJob(CallerIdentity caller, long jobId) {
        Job job = requireJob(ledgerStore, jobId);
        if (!job.isAssignedAgent(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the assigned agent can complete job " + jobId);
        }
        requireStatus(job, JobStatus.IN_PROGRESS);
        if (!job.allMilestonesApproved()) {
            throw MarketplaceException.invalidState("Job " + jobId + " has milestones that are not approved");
        }
        EscrowRecord escrow = requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        BigDecimal released = escrowManager.releaseRemaining(escrow, now);
        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(now);
        job.setUpdatedAt(now);

        LedgerTransaction transaction = new LedgerTransaction()
                .save(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.JOB_COMPLETED, jobId, caller.getId(), job.getClient(), null, now));
        ledgerStore.agent(job.getAgent()).ifPresent(profile -> {
            profile.setJobsCompleted(profile.getJobsCompleted() + 1);
            transaction.save(profile);
        });
        if (released.signum() > 0) {
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_RELEASED, jobId, job.getClient(), job.getAgent(), released, now));
        }
        committer.commit("complete_job", transaction);

        log.info("Job {} completed by {}, released {}", jobId, caller.getId(), released.toPlainString());
        return jobId;
    }

    @Override
    public long cancelJob(CallerIdentity caller, long jobId) {
        Job job = requireJob(ledgerStore, jobId);
        if (!job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client can cancel job " + jobId);
        }
        requireStatus(job, JobStatus.POSTED);
        EscrowRecord escrow = requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        BigDecimal refunded = escrowManager.refundRemaining(escrow, now);
        job.setStatus(JobStatus.CANCELLED);
        job.setUpdatedAt(now);

        LedgerTransaction transaction = new LedgerTransaction()
                .save(job)
                .publish(MarketplaceEvent.of(MarketplaceEventType.JOB_CANCELLED, jobId, caller.getId(), null, null, now));
        if (refunded.signum() > 0) {
            transaction.save(escrow);
            transaction.publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_REFUNDED, jobId, caller.getId(), caller.getId(), refunded, now));
        } else {
            transaction.guard(escrow);
        }
        committer.commit("cancel_job", transaction);

        log.info("Job {} cancelled by {}, refunded {}", jobId, caller.getId(), refunded.toPlainString());
        return jobId;
    }

    private List<Milestone> buildMilestones(List<MilestoneRequest> requests) {
        List<Milestone> milestones = new ArrayList<>();
        if (requests == null) {
            return milestones;
        }
        int total = 0;
        long nextId = 1;
        for (MilestoneRequest request : requests) {
            if (request == null || request.getTitle() == null || request.getTitle().isBlank()) {
                throw new MarketplaceException(ErrorCode.INVALID_MILESTONES, "Every milestone needs a title");
            }
            Integer percentage = request.getPaymentPercentage();
            if (percentage == null || percentage < 0 || percentage > 100) {
                throw new MarketplaceException(ErrorCode.INVALID_MILESTONES,
                        "Milestone payment percentage must be between 0 and 100");
            }
            total += percentage;
            if (total > 100) {
                throw new MarketplaceException(ErrorCode.INVALID_MILESTONES,
                        "Milestone payment percentages add up to more than 100");
            }
            milestones.add(Milestone.builder()
                    .id(nextId++)
                    .title(request.getTitle().trim())
                    .description(Inputs.optionalText(request.getDescription()))
                    .paymentPercentage(percentage)
                    .status(MilestoneStatus.PENDING)
                    .dueDate(request.getDueDate())
                    .build());
        }
        return milestones;
    }

    static Job requireJob(LedgerView ledger, long jobId) {
        return ledger.job(jobId).orElseThrow(() -> MarketplaceException.notFound("Job", jobId));
    }

    static EscrowRecord requireEscrow(LedgerView ledger, long jobId) {
        return ledger.escrow(jobId).orElseThrow(() -> MarketplaceException.notFound("Escrow for job", jobId));
    }

    static void requireStatus(Job job, JobStatus expected) {
        if (job.getStatus() != expected) {
            throw MarketplaceException.invalidState("Job " + job.getId() + " is " + job.getStatus() + ", expected " + expected);
        }
    }
}
