package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.store.LedgerRecord;
import ai.agentmarket.backend.store.RecordType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Job-scoped message between two participants. Only the read flag ever changes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatMessage implements LedgerRecord {

    private long id;

    private long jobId;

    private String sender;

    private String recipient;

    private String content;

    private Instant timestamp;

    private boolean read;

    private long version;

    public static String key(long messageId) {
        return RecordType.MESSAGE.key(messageId);
    }

    @Override
    public RecordType recordType() {
        return RecordType.MESSAGE;
    }

    @Override
    public String ledgerKey() {
        return key(id);
    }

    @Override
    public Long jobScope() {
        return jobId;
    }

    @Override
    public ChatMessage copy() {
        return toBuilder().build();
    }
}
