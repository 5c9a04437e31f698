package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscrowStatus {
    UNFUNDED,
    LOCKED,
    RELEASED,
    REFUNDED,
    PARTIALLY_RELEASED;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static EscrowStatus fromToken(String token) {
        return EnumTokens.parse(EscrowStatus.class, token);
    }

    /**
     * Funds are held and may still be disbursed.
     */
    public boolean isActive() {
        return this == LOCKED || this == PARTIALLY_RELEASED;
    }
}
