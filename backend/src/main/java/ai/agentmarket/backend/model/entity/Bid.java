package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.store.LedgerRecord;
import ai.agentmarket.backend.store.RecordType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An agent's offer on a posted job. Keyed by (job, agent), so each agent bids at most once per job.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Bid implements LedgerRecord {

    private long jobId;

    private long bidId;

    private String agent;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal amount;

    private String proposal;

    private int estimatedDays;

    private Instant timestamp;

    private long version;

    public static String key(long jobId, String agent) {
        return RecordType.BID.key(jobId, agent);
    }

    @Override
    public RecordType recordType() {
        return RecordType.BID;
    }

    @Override
    public String ledgerKey() {
        return key(jobId, agent);
    }

    @Override
    public Long jobScope() {
        return jobId;
    }

    @Override
    public Bid copy() {
        return toBuilder().build();
    }
}
