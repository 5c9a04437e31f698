package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DisputeStatus {
    OPEN,
    RESPONDED,
    RESOLVED_FOR_CLIENT,
    RESOLVED_FOR_AGENT,
    RESOLVED_SPLIT;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static DisputeStatus fromToken(String token) {
        return EnumTokens.parse(DisputeStatus.class, token);
    }

    public boolean isResolved() {
        return this == RESOLVED_FOR_CLIENT || this == RESOLVED_FOR_AGENT || this == RESOLVED_SPLIT;
    }
}
