package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.EscrowAmountRequest;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.util.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Client-initiated escrow mutations: pre-funding a posted job and partial releases while it runs.
 */
@Slf4j
@Service
public class EscrowService {

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final EscrowManager escrowManager;
    private final Clock clock;

    public EscrowService(LedgerStore ledgerStore, LedgerCommitter committer, EscrowManager escrowManager, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.escrowManager = escrowManager;
        this.clock = clock;
    }

    /**
     * Locks funds for a posted job before any bid is accepted.
     *
     * @return the job id
     */
    public long fundEscrow(CallerIdentity caller, long jobId, EscrowAmountRequest request) {
        BigDecimal amount = Amounts.parsePositive(request.getAmount(), "Escrow amount");
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client can fund escrow for job " + jobId);
        }
        JobLedgerServiceImpl.requireStatus(job, JobStatus.POSTED);
        EscrowRecord escrow = JobLedgerServiceImpl.requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        escrowManager.fund(escrow, amount, now);
        committer.commit("fund_escrow", new LedgerTransaction()
                .guard(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.ESCROW_FUNDED, jobId, caller.getId(), null, amount, now)));

        log.info("Escrow for job {} funded with {}", jobId, amount.toPlainString());
        return jobId;
    }

    /**
     * Releases part of the balance to the assigned agent while the job is in progress.
     *
     * @return the job id
     */
    public long releaseEscrow(CallerIdentity caller, long jobId, EscrowAmountRequest request) {
        BigDecimal amount = Amounts.parsePositive(request.getAmount(), "Release amount");
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!job.isClient(caller.getId())) {
            throw MarketplaceException.unauthorized("Only the client can release escrow for job " + jobId);
        }
        EscrowRecord escrow = JobLedgerServiceImpl.requireEscrow(ledgerStore, jobId);

        Instant now = clock.instant();
        if (escrow.getAgent() == null) {
            throw new MarketplaceException(ErrorCode.NO_AGENT, "Job " + jobId + " has no assigned agent");
        }
        JobLedgerServiceImpl.requireStatus(job, JobStatus.IN_PROGRESS);
        escrowManager.release(escrow, amount, now);

        committer.commit("release_escrow", new LedgerTransaction()
                .guard(job)
                .save(escrow)
                .publish(MarketplaceEvent.of(MarketplaceEventType.PAYMENT_RELEASED, jobId, caller.getId(), job.getAgent(), amount, now)));

        log.info("Released {} from escrow of job {} to {}", amount.toPlainString(), jobId, job.getAgent());
        return jobId;
    }
}
