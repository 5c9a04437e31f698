package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.JobCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;

/**
 * DTO for posting a new job.
 * Amounts are decimal strings so no precision is lost in transit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostJobRequest {

    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @Size(max = 10000, message = "Description must be at most 10000 characters")
    private String description;

    /**
     * Offered payment, e.g. "100" or "12.5"
     */
    private String payment;

    private JobCategory category;

    @Size(max = 20, message = "At most 20 tags are allowed")
    private List<String> tags;

    /**
     * Optional deadline, must not be in the past
     */
    private Instant deadline;

    @Valid
    @Size(max = 50, message = "At most 50 milestones are allowed")
    private List<MilestoneRequest> milestones;
}
