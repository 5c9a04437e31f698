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

/**
 * Public profile of a registered agent, keyed by its owner principal.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentProfile implements LedgerRecord {

    private String owner;

    private String name;

    private String serviceDescription;

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private List<String> portfolioUrls = new ArrayList<>();

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal hourlyRate;

    private boolean availability;

    private long jobsCompleted;

    private long totalRatingPoints;

    private long totalRatings;

    private VerificationLevel verificationLevel;

    private Instant registeredAt;

    private Instant updatedAt;

    private long version;

    public static String key(String owner) {
        return RecordType.AGENT.key(owner);
    }

    @Override
    public RecordType recordType() {
        return RecordType.AGENT;
    }

    @Override
    public String ledgerKey() {
        return key(owner);
    }

    @Override
    public AgentProfile copy() {
        return toBuilder()
                .skills(skills == null ? new ArrayList<>() : new ArrayList<>(skills))
                .portfolioUrls(portfolioUrls == null ? new ArrayList<>() : new ArrayList<>(portfolioUrls))
                .build();
    }

    /**
     * Average rating, 0 when the agent has not been rated yet.
     */
    public double getRating() {
        return totalRatings == 0 ? 0.0 : (double) totalRatingPoints / totalRatings;
    }

    public boolean hasSkill(String skill) {
        return skills != null && skills.stream().anyMatch(s -> s.equalsIgnoreCase(skill));
    }
}
