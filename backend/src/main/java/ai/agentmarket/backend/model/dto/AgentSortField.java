package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum AgentSortField {
    JOBS_COMPLETED,
    RATING,
    REGISTERED_AT,
    HOURLY_RATE;

    @JsonCreator
    public static AgentSortField fromToken(String token) {
        return EnumTokens.parse(AgentSortField.class, token);
    }
}
