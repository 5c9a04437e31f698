package ai.agentmarket.backend.model.entity;

import ai.agentmarket.backend.util.EnumTokens;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobCategory {
    DEVELOPMENT,
    DESIGN,
    WRITING,
    DATA_ANALYSIS,
    SECURITY,
    RESEARCH,
    MARKETING,
    TRANSLATION,
    AI_ML,
    OTHER;

    @JsonValue
    public String getValue() {
        return name();
    }

    @JsonCreator
    public static JobCategory fromToken(String token) {
        return EnumTokens.parse(JobCategory.class, token);
    }
}
