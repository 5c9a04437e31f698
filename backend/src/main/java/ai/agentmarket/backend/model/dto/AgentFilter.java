package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.VerificationLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Agent query criteria; null fields do not filter.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentFilter {

    private Long minJobsCompleted;

    /**
     * Agents without ratings fail any positive minimum
     */
    private Double minRating;

    private String skill;
    private Boolean available;
    private VerificationLevel minVerificationLevel;
}
