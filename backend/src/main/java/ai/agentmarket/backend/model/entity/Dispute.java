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

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Dispute implements LedgerRecord {

    private long id;

    private long jobId;

    private String initiator;

    /**
     * The other party of the job, the only one allowed to respond.
     */
    private String respondent;

    private String reason;

    private String response;

    private DisputeStatus status;

    private Instant createdAt;

    private Instant respondedAt;

    private Instant resolvedAt;

    private String resolvedBy;

    private String resolutionNotes;

    /**
     * Share of the balance refunded to the client; set for split resolutions only.
     */
    private Integer refundPercentage;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal refundedAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal releasedAmount;

    private long version;

    public static String key(long disputeId) {
        return RecordType.DISPUTE.key(disputeId);
    }

    @Override
    public RecordType recordType() {
        return RecordType.DISPUTE;
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
    public Dispute copy() {
        return toBuilder().build();
    }

    public boolean involves(String user) {
        return user != null && (user.equals(initiator) || user.equals(respondent));
    }
}
