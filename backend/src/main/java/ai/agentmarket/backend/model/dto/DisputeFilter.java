package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.DisputeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeFilter {

    private DisputeStatus status;
    private Long jobId;

    /**
     * Matches the initiator or the respondent
     */
    private String party;
}
