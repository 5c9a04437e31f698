package ai.agentmarket.backend.model.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A payable slice of a job. Stored inside its {@link Job}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Milestone {

    /**
     * 1-based position in posting order.
     */
    private long id;

    private String title;

    private String description;

    private int paymentPercentage;

    private MilestoneStatus status;

    private Instant dueDate;

    private String submissionNotes;

    private String revisionFeedback;

    private Instant submittedAt;

    private Instant approvedAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal releasedAmount;

    public Milestone copy() {
        return toBuilder().build();
    }
}
