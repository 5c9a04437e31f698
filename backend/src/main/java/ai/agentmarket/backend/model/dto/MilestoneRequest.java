package ai.agentmarket.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Size;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MilestoneRequest {

    @Size(max = 200, message = "Milestone title must be at most 200 characters")
    private String title;

    @Size(max = 5000, message = "Milestone description must be at most 5000 characters")
    private String description;

    /**
     * Share of the accepted bid paid on approval, 0-100
     */
    private Integer paymentPercentage;

    private Instant dueDate;
}
