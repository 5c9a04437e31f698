package ai.agentmarket.backend.store;

import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.Rating;

/**
 * Kinds of records in the ledger and the key prefix each is stored under.
 */
public enum RecordType {
    JOB("job", Job.class),
    BID("bid", Bid.class),
    ESCROW("escrow", EscrowRecord.class),
    AGENT("agent", AgentProfile.class),
    DISPUTE("dispute", Dispute.class),
    RATING("rating", Rating.class),
    MESSAGE("message", ChatMessage.class);

    private static final char SEPARATOR = ':';

    private final String prefix;
    private final Class<? extends LedgerRecord> recordClass;

    RecordType(String prefix, Class<? extends LedgerRecord> recordClass) {
        this.prefix = prefix;
        this.recordClass = recordClass;
    }

    public String getPrefix() {
        return prefix;
    }

    public Class<? extends LedgerRecord> getRecordClass() {
        return recordClass;
    }

    public String key(Object... parts) {
        StringBuilder sb = new StringBuilder(prefix);
        for (Object part : parts) {
            sb.append(SEPARATOR).append(part);
        }
        return sb.toString();
    }

    public static RecordType ofKey(String key) {
        int end = key.indexOf(SEPARATOR);
        String keyPrefix = end < 0 ? key : key.substring(0, end);
        for (RecordType type : values()) {
            if (type.prefix.equals(keyPrefix)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ledger key: " + key);
    }
}
