package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.DisputeStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Size;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResolveDisputeRequest {

    /**
     * One of the RESOLVED_* statuses
     */
    private DisputeStatus resolution;

    /**
     * Share of the balance refunded to the client, required for RESOLVED_SPLIT
     */
    private Integer refundPercentage;

    @Size(max = 5000, message = "Notes must be at most 5000 characters")
    private String notes;
}
