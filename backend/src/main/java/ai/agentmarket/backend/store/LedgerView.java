package ai.agentmarket.backend.store;

import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.Rating;

import java.util.List;
import java.util.Optional;

/**
 * Typed lookups of single records and of the records belonging to one job.
 * Implemented by {@link LedgerSnapshot} over a loaded view and by {@link LedgerStore} with keyed reads.
 * Returned records are copies.
 */
public interface LedgerView {

    Optional<Job> job(long jobId);

    Optional<Bid> bid(long jobId, String agent);

    /**
     * Bids on one job ordered by bid id.
     */
    List<Bid> bids(long jobId);

    Optional<EscrowRecord> escrow(long jobId);

    Optional<AgentProfile> agent(String owner);

    Optional<Dispute> dispute(long disputeId);

    /**
     * Disputes of one job ordered by id.
     */
    List<Dispute> disputes(long jobId);

    Optional<Rating> rating(long jobId, String rater);

    /**
     * Messages of one job ordered by timestamp, then id.
     */
    List<ChatMessage> messages(long jobId);
}
