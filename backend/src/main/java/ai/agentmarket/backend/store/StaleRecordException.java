package ai.agentmarket.backend.store;

import lombok.Getter;

/**
 * A commit lost an optimistic-concurrency race: a record it depended on has a newer version.
 */
@Getter
public class StaleRecordException extends RuntimeException {

    private final String conflictKey;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleRecordException(String conflictKey, long expectedVersion, long actualVersion) {
        super("Record " + conflictKey + " is at version " + actualVersion + ", expected " + expectedVersion);
        this.conflictKey = conflictKey;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    /**
     * True when two writers raced to create the same record.
     */
    public boolean isCreateConflict() {
        return expectedVersion == 0 && actualVersion > 0;
    }

    public RecordType getRecordType() {
        return RecordType.ofKey(conflictKey);
    }
}
