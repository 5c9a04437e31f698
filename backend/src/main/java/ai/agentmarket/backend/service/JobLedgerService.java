package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.dto.AcceptBidRequest;
import ai.agentmarket.backend.model.dto.PlaceBidRequest;
import ai.agentmarket.backend.model.dto.PostJobRequest;
import ai.agentmarket.backend.security.CallerIdentity;

/**
 * Job lifecycle: posting, bidding, acceptance, completion and cancellation.
 *
 * Status graph: POSTED -> IN_PROGRESS -> COMPLETED, POSTED -> CANCELLED.
 * Disputes move IN_PROGRESS jobs through DISPUTED (see {@link DisputeService}).
 * Every operation either commits all of its changes or none, and reports failures as
 * {@link ai.agentmarket.backend.service.exception.MarketplaceException}.
 */
public interface JobLedgerService {

    /**
     * Posts a job with an unfunded escrow.
     *
     * @param caller the posting client
     * @param request the job definition
     * @return the new job id
     */
    long postJob(CallerIdentity caller, PostJobRequest request);

    /**
     * Places the caller's bid on a posted job. The caller must be a registered agent.
     *
     * @return the bid id, unique within the job
     */
    long placeBid(CallerIdentity caller, long jobId, PlaceBidRequest request);

    /**
     * Accepts the bid of the given agent at the given amount and locks escrow at that amount.
     *
     * @return the job id
     */
    long acceptBid(CallerIdentity caller, long jobId, AcceptBidRequest request);

    /**
     * Completes an in-progress job whose milestones are all approved, releasing the escrow balance.
     *
     * @return the job id
     */
    long completeJob(CallerIdentity caller, long jobId);

    /**
     * Cancels a posted job and refunds any pre-funded escrow.
     *
     * @return the job id
     */
    long cancelJob(CallerIdentity caller, long jobId);
}
