package ai.agentmarket.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Marketplace-wide counters computed from one snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketplaceStats {

    private long totalJobs;
    private long postedJobs;
    private long inProgressJobs;
    private long completedJobs;
    private long cancelledJobs;
    private long disputedJobs;
    private long totalAgents;

    /**
     * Sum of the payments offered by all jobs
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal totalPaymentVolume;

    /**
     * Sum of balances still held by active escrows
     */
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal totalEscrowLocked;

    private long openDisputes;
}
