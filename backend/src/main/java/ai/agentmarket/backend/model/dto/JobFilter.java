package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.model.entity.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Job query criteria; null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobFilter {

    private JobStatus status;
    private BigDecimal minPayment;
    private BigDecimal maxPayment;
    private String client;
    private String agent;
    private JobCategory category;
    private String tag;
}
