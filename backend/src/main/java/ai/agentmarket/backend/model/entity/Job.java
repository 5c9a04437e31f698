package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.store.LedgerRecord;
import ai.agentmarket.backend.store.RecordType;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A unit of work posted by a client. Bids are stored as separate {@link Bid} records.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job implements LedgerRecord {

    private long id;

    private String client;

    private String title;

    private String description;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal payment;

    private JobStatus status;

    /**
     * Assigned agent; set only while the job is in progress, disputed or completed.
     */
    private String agent;

    private JobCategory category;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant deadline;

    @Builder.Default
    private List<Milestone> milestones = new ArrayList<>();

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal acceptedBidAmount;

    private long escrowId;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant completedAt;

    private long version;

    public static String key(long jobId) {
        return RecordType.JOB.key(jobId);
    }

    @Override
    public RecordType recordType() {
        return RecordType.JOB;
    }

    @Override
    public String ledgerKey() {
        return key(id);
    }

    @Override
    public Job copy() {
        List<Milestone> copiedMilestones = new ArrayList<>();
        if (milestones != null) {
            milestones.forEach(m -> copiedMilestones.add(m.copy()));
        }
        return toBuilder()
                .tags(tags == null ? new ArrayList<>() : new ArrayList<>(tags))
                .milestones(copiedMilestones)
                .build();
    }

    public boolean isClient(String user) {
        return Objects.equals(client, user);
    }

    public boolean isAssignedAgent(String user) {
        return agent != null && agent.equals(user);
    }

    public Optional<Milestone> findMilestone(long milestoneId) {
        return milestones.stream().filter(m -> m.getId() == milestoneId).findFirst();
    }

    public boolean allMilestonesApproved() {
        return milestones.stream().allMatch(m -> m.getStatus() == MilestoneStatus.APPROVED);
    }
}
