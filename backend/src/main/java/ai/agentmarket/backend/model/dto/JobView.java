package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Milestone;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A job as seen by API clients, with its bids ordered by bid id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobView {

    private long id;
    private String client;
    private String title;
    private String description;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal payment;

    private JobStatus status;
    private String agent;
    private JobCategory category;
    private List<String> tags;
    private Instant deadline;
    private List<Bid> bids;
    private List<Milestone> milestones;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal acceptedBidAmount;

    private long escrowId;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    public static JobView of(Job job, List<Bid> bids) {
        return JobView.builder()
                .id(job.getId())
                .client(job.getClient())
                .title(job.getTitle())
                .description(job.getDescription())
                .payment(job.getPayment())
                .status(job.getStatus())
                .agent(job.getAgent())
                .category(job.getCategory())
                .tags(job.getTags())
                .deadline(job.getDeadline())
                .bids(bids)
                .milestones(job.getMilestones())
                .acceptedBidAmount(job.getAcceptedBidAmount())
                .escrowId(job.getEscrowId())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
