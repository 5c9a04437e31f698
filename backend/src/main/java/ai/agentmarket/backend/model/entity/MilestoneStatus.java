package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MilestoneStatus {
    PENDING,
    SUBMITTED,
    APPROVED,
    REVISION_REQUESTED;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static MilestoneStatus fromToken(String token) {
        return EnumTokens.parse(MilestoneStatus.class, token);
    }

    /**
     * Whether the agent may (re)submit work for a milestone in this state.
     */
    public boolean isSubmittable() {
        return this == PENDING || this == REVISION_REQUESTED;
    }
}
