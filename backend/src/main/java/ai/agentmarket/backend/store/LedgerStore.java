package ai.agentmarket.backend.store;

import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.Rating;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Versioned record store behind the marketplace ledger.
 *
 * Mutations read the records they need by key (see {@link LedgerView}) and submit a
 * {@link LedgerTransaction} that is applied atomically only if every record version it read is still
 * current. Full snapshots are for list and aggregate queries only.
 */
public interface LedgerStore extends LedgerView {

    /**
     * Consistent point-in-time view of every record.
     */
    LedgerSnapshot snapshot();

    /**
     * Reads one record by its ledger key.
     */
    <T extends LedgerRecord> Optional<T> find(String key, Class<T> recordClass);

    /**
     * Records of one type whose {@link LedgerRecord#jobScope()} is the given job, in no particular order.
     */
    <T extends LedgerRecord> List<T> findByJob(long jobId, RecordType type, Class<T> recordClass);

    /**
     * Every record of one type, in no particular order. Not a consistent view across types.
     */
    <T extends LedgerRecord> List<T> findAll(RecordType type, Class<T> recordClass);

    /**
     * Number of committed records across all types.
     */
    long count();

    /**
     * Applies all writes of the transaction or none of them.
     *
     * @throws StaleRecordException when a guarded or written record changed since it was read
     */
    void commit(LedgerTransaction transaction);

    /**
     * Short name of the backing technology, reported by health checks.
     */
    String storeType();

    @Override
    default Optional<Job> job(long jobId) {
        return find(Job.key(jobId), Job.class);
    }

    @Override
    default Optional<Bid> bid(long jobId, String agent) {
        if (agent == null) {
            return Optional.empty();
        }
        return find(Bid.key(jobId, agent), Bid.class);
    }

    @Override
    default List<Bid> bids(long jobId) {
        return sorted(findByJob(jobId, RecordType.BID, Bid.class), Comparator.comparingLong(Bid::getBidId));
    }

    @Override
    default Optional<EscrowRecord> escrow(long jobId) {
        return find(EscrowRecord.key(jobId), EscrowRecord.class);
    }

    @Override
    default Optional<AgentProfile> agent(String owner) {
        if (owner == null) {
            return Optional.empty();
        }
        return find(AgentProfile.key(owner), AgentProfile.class);
    }

    @Override
    default Optional<Dispute> dispute(long disputeId) {
        return find(Dispute.key(disputeId), Dispute.class);
    }

    @Override
    default List<Dispute> disputes(long jobId) {
        return sorted(findByJob(jobId, RecordType.DISPUTE, Dispute.class), Comparator.comparingLong(Dispute::getId));
    }

    @Override
    default Optional<Rating> rating(long jobId, String rater) {
        if (rater == null) {
            return Optional.empty();
        }
        return find(Rating.key(jobId, rater), Rating.class);
    }

    @Override
    default List<ChatMessage> messages(long jobId) {
        return sorted(findByJob(jobId, RecordType.MESSAGE, ChatMessage.class),
                Comparator.comparing(ChatMessage::getTimestamp).thenComparingLong(ChatMessage::getId));
    }

    private static <T> List<T> sorted(List<T> records, Comparator<T> order) {
        return records.stream().sorted(order).collect(Collectors.toList());
    }
}
