package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Agent verification tiers, ordered from weakest to strongest.
 */
public enum VerificationLevel {
    UNVERIFIED,
    BASIC,
    VERIFIED,
    PREMIUM;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static VerificationLevel fromToken(String token) {
        return EnumTokens.parse(VerificationLevel.class, token);
    }

    public boolean isAtLeast(VerificationLevel other) {
        return compareTo(other) >= 0;
    }
}
