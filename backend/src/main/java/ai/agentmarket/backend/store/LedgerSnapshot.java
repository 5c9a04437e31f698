package ai.agentmarket.backend.store;

import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.Rating;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time view of the ledger.
 *
 * Every accessor hands out copies, so callers may modify what they get and stage it in a
 * {@link LedgerTransaction} without affecting the snapshot.
 */
public final class LedgerSnapshot implements LedgerView {

    private final Map<RecordType, Map<String, LedgerRecord>> recordsByType;

    public LedgerSnapshot(Collection<? extends LedgerRecord> records) {
        Map<RecordType, Map<String, LedgerRecord>> byType = new EnumMap<>(RecordType.class);
        for (RecordType type : RecordType.values()) {
            byType.put(type, new HashMap<>());
        }
        for (LedgerRecord record : records) {
            byType.get(record.recordType()).put(record.ledgerKey(), record);
        }
        this.recordsByType = byType;
    }

    public static LedgerSnapshot empty() {
        return new LedgerSnapshot(List.of());
    }

    @Override
    public Optional<Job> job(long jobId) {
        return find(RecordType.JOB, Job.key(jobId), Job.class);
    }

    public List<Job> jobs() {
        return all(RecordType.JOB, Job.class, Comparator.comparingLong(Job::getId));
    }

    @Override
    public Optional<Bid> bid(long jobId, String agent) {
        return find(RecordType.BID, Bid.key(jobId, agent), Bid.class);
    }

    @Override
    public List<Bid> bids(long jobId) {
        return ofJob(RecordType.BID, jobId, Bid.class, Comparator.comparingLong(Bid::getBidId));
    }

    @Override
    public Optional<EscrowRecord> escrow(long jobId) {
        return find(RecordType.ESCROW, EscrowRecord.key(jobId), EscrowRecord.class);
    }

    public List<EscrowRecord> escrows() {
        return all(RecordType.ESCROW, EscrowRecord.class, Comparator.comparingLong(EscrowRecord::getJobId));
    }

    @Override
    public Optional<AgentProfile> agent(String owner) {
        if (owner == null) {
            return Optional.empty();
        }
        return find(RecordType.AGENT, AgentProfile.key(owner), AgentProfile.class);
    }

    public List<AgentProfile> agents() {
        return all(RecordType.AGENT, AgentProfile.class, Comparator.comparing(AgentProfile::getOwner));
    }

    @Override
    public Optional<Dispute> dispute(long disputeId) {
        return find(RecordType.DISPUTE, Dispute.key(disputeId), Dispute.class);
    }

    public List<Dispute> disputes() {
        return all(RecordType.DISPUTE, Dispute.class, Comparator.comparingLong(Dispute::getId));
    }

    @Override
    public List<Dispute> disputes(long jobId) {
        return ofJob(RecordType.DISPUTE, jobId, Dispute.class, Comparator.comparingLong(Dispute::getId));
    }

    @Override
    public Optional<Rating> rating(long jobId, String rater) {
        return find(RecordType.RATING, Rating.key(jobId, rater), Rating.class);
    }

    public List<Rating> ratings() {
        return all(RecordType.RATING, Rating.class, Comparator.comparingLong(Rating::getId));
    }

    public List<ChatMessage> messages() {
        return all(RecordType.MESSAGE, ChatMessage.class,
                Comparator.comparing(ChatMessage::getTimestamp).thenComparingLong(ChatMessage::getId));
    }

    @Override
    public List<ChatMessage> messages(long jobId) {
        return ofJob(RecordType.MESSAGE, jobId, ChatMessage.class,
                Comparator.comparing(ChatMessage::getTimestamp).thenComparingLong(ChatMessage::getId));
    }

    public int size() {
        return recordsByType.values().stream().mapToInt(Map::size).sum();
    }

    private <T extends LedgerRecord> Optional<T> find(RecordType type, String key, Class<T> recordClass) {
        LedgerRecord record = recordsByType.get(type).get(key);
        return Optional.ofNullable(record).map(r -> recordClass.cast(r.copy()));
    }

    private <T extends LedgerRecord> List<T> ofJob(RecordType type, long jobId, Class<T> recordClass, Comparator<T> order) {
        return recordsByType.get(type).values().stream()
                .filter(r -> r.jobScope() != null && r.jobScope() == jobId)
                .map(recordClass::cast)
                .sorted(order)
                .map(r -> recordClass.cast(r.copy()))
                .collect(Collectors.toList());
    }

    private <T extends LedgerRecord> List<T> all(RecordType type, Class<T> recordClass, Comparator<T> order) {
        return recordsByType.get(type).values().stream()
                .map(recordClass::cast)
                .sorted(order)
                .map(r -> recordClass.cast(r.copy()))
                .collect(Collectors.toList());
    }
}
