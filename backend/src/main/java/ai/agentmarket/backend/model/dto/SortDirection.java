package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum SortDirection {
    ASC,
    DESC;

    @JsonCreator
    public static SortDirection fromToken(String token) {
        return EnumTokens.parse(SortDirection.class, token);
    }
}
