package ai.agentmarket.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identifier of the record a mutation created or updated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MutationResponse {

    private Object id;

    public static MutationResponse of(Object id) {
        return new MutationResponse(id);
    }
}
