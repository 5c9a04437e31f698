package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a job. Completed and Cancelled are terminal.
 */
public enum JobStatus {
    POSTED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    DISPUTED;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static JobStatus fromToken(String token) {
        return EnumTokens.parse(JobStatus.class, token);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * Statuses in which the job has an assigned agent.
     */
    public boolean hasAgent() {
        return this == IN_PROGRESS || this == COMPLETED || this == DISPUTED;
    }
}
