package ai.agentmarket.backend.model.dto;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum JobSortField {
    CREATED_AT,
    PAYMENT,
    ID,
    DEADLINE;

    @JsonCreator
    public static JobSortField fromToken(String token) {
        return EnumTokens.parse(JobSortField.class, token);
    }
}
