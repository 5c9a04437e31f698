package ai.agentmarket.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import jakarta.validation.constraints.Size;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegisterAgentRequest {

    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @Size(max = 5000, message = "Service description must be at most 5000 characters")
    private String serviceDescription;

    @Size(max = 50, message = "At most 50 skills are allowed")
    private List<String> skills;

    @Size(max = 20, message = "At most 20 portfolio URLs are allowed")
    private List<String> portfolioUrls;

    /**
     * Optional hourly rate as a decimal string
     */
    private String hourlyRate;
}
