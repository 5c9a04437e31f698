package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.store.LedgerRecord;
import ai.agentmarket.backend.store.RecordType;
import ai.agentmarket.backend.util.Amounts;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Funds held for one job. Invariant: released + refunded never exceeds the locked amount, which
 * equals the accepted bid once a bid is accepted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscrowRecord implements LedgerRecord {

    private long escrowId;

    private long jobId;

    private String client;

    private String agent;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Builder.Default
    private BigDecimal amount = BigDecimal.ZERO;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Builder.Default
    private BigDecimal releasedAmount = BigDecimal.ZERO;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Builder.Default
    private BigDecimal refundedAmount = BigDecimal.ZERO;

    /**
     * Amount the client locked before acceptance; null when the escrow was locked at acceptance.
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal fundedAmount;

    /**
     * Part of the pre-funded amount above the accepted bid, returned to the client at acceptance.
     * Not counted in {@code refundedAmount}, which only covers the locked amount.
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    @Builder.Default
    private BigDecimal surplusRefunded = BigDecimal.ZERO;

    private EscrowStatus status;

    private Instant createdAt;

    private Instant lockedAt;

    private Instant releasedAt;

    private long version;

    public static String key(long jobId) {
        return RecordType.ESCROW.key(jobId);
    }

    @Override
    public RecordType recordType() {
        return RecordType.ESCROW;
    }

    @Override
    public String ledgerKey() {
        return key(jobId);
    }

    @Override
    public EscrowRecord copy() {
        return toBuilder().build();
    }

    /**
     * Funds still held: locked minus everything released or refunded.
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    public BigDecimal getBalance() {
        BigDecimal balance = Amounts.zeroIfNull(amount)
                .subtract(Amounts.zeroIfNull(releasedAmount))
                .subtract(Amounts.zeroIfNull(refundedAmount));
        return Amounts.normalize(balance);
    }
}
