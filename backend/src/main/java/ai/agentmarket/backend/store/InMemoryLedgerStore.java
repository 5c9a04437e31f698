package ai.agentmarket.backend.store;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Ledger store kept in process memory.
 *
 * Committed state is an immutable value replaced on every commit (copy-on-write), so reads are
 * lock-free and never observe a half-applied transaction. Commits are serialized by a lock.
 * Records with a job scope are also indexed by job and type, so keyed and per-job reads never scan
 * the whole ledger.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile State state = new State(Map.of(), Map.of());

    @Override
    public LedgerSnapshot snapshot() {
        return new LedgerSnapshot(state.records.values());
    }

    @Override
    public <T extends LedgerRecord> Optional<T> find(String key, Class<T> recordClass) {
        return Optional.ofNullable(state.records.get(key)).map(record -> recordClass.cast(record.copy()));
    }

    @Override
    public <T extends LedgerRecord> List<T> findByJob(long jobId, RecordType type, Class<T> recordClass) {
        State current = state;
        return current.jobIndex.getOrDefault(jobIndexKey(jobId, type), Set.of()).stream()
                .map(current.records::get)
                .map(record -> recordClass.cast(record.copy()))
                .collect(Collectors.toList());
    }

    @Override
    public <T extends LedgerRecord> List<T> findAll(RecordType type, Class<T> recordClass) {
        return state.records.values().stream()
                .filter(record -> record.recordType() == type)
                .map(record -> recordClass.cast(record.copy()))
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return state.records.size();
    }

    @Override
    public void commit(LedgerTransaction transaction) {
        writeLock.lock();
        try {
            State current = state;
            for (Map.Entry<String, Long> expected : transaction.getExpectedVersions().entrySet()) {
                LedgerRecord existing = current.records.get(expected.getKey());
                long actualVersion = existing == null ? 0L : existing.getVersion();
                if (actualVersion != expected.getValue()) {
                    throw new StaleRecordException(expected.getKey(), expected.getValue(), actualVersion);
                }
            }

            Map<String, LedgerRecord> records = new HashMap<>(current.records);
            Map<String, Set<String>> jobIndex = new HashMap<>(current.jobIndex);
            for (LedgerRecord write : transaction.getWrites()) {
                LedgerRecord stored = write.copy();
                stored.setVersion(write.getVersion() + 1);
                records.put(stored.ledgerKey(), stored);
                if (stored.jobScope() != null) {
                    String indexKey = jobIndexKey(stored.jobScope(), stored.recordType());
                    Set<String> keys = new HashSet<>(jobIndex.getOrDefault(indexKey, Set.of()));
                    keys.add(stored.ledgerKey());
                    jobIndex.put(indexKey, Set.copyOf(keys));
                }
            }
            state = new State(Map.copyOf(records), Map.copyOf(jobIndex));
            log.debug("Committed {} record(s) to in-memory ledger", transaction.getWrites().size());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String storeType() {
        return "memory";
    }

    private static String jobIndexKey(long jobId, RecordType type) {
        return jobId + ":" + type.getPrefix();
    }

    private static final class State {
        private final Map<String, LedgerRecord> records;
        private final Map<String, Set<String>> jobIndex;

        private State(Map<String, LedgerRecord> records, Map<String, Set<String>> jobIndex) {
            this.records = records;
            this.jobIndex = jobIndex;
        }
    }
}
