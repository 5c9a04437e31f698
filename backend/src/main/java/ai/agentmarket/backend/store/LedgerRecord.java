package ai.agentmarket.backend.store;

/**
 * A versioned record held by a {@link LedgerStore}.
 * The version is 0 for a record that has never been committed and grows by one on every commit.
 */
public interface LedgerRecord {

    RecordType recordType();

    /**
     * Store key of this record, unique across all record types.
     */
    String ledgerKey();

    /**
     * Id of the job this record is indexed under for {@link LedgerStore#findByJob}, or null when the
     * record is only ever read by key.
     */
    default Long jobScope() {
        return null;
    }

    long getVersion();

    void setVersion(long version);

    /**
     * Deep copy, so callers can mutate a record read from a snapshot without touching the snapshot.
     */
    LedgerRecord copy();
}
