package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.MilestoneSubmissionRequest;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.MilestoneService;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.config.SecurityConfig;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = MilestoneController.class)
@Import({SecurityConfig.class, CallerResolver.class, MarketplaceMetricsService.class})
class MilestoneControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @SuppressWarnings("removal")
    @MockBean
    private MarketplaceQueryService queryService;

    @SuppressWarnings("removal")
    @MockBean
    private JwtDecoder jwtDecoder;

    @TestConfiguration
    static class MetricsTestConfig {
        @Bean
        @Primary
        MeterRegistry testMeterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @SuppressWarnings("removal")
    @MockBean
    private MilestoneService milestoneService;

    @Test
    @DisplayName("Submit works without a request body")
    void submitWithoutBody() throws Exception {
        when(milestoneService.submitMilestone(any(), eq(2L), eq(1L), any())).thenReturn(1L);

        mockMvc.perform(post("/api/v1/jobs/2/milestones/1/submit")
                        .with(jwt().jwt(j -> j.subject("agent-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1));

        ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
        ArgumentCaptor<MilestoneSubmissionRequest> request = ArgumentCaptor.forClass(MilestoneSubmissionRequest.class);
        verify(milestoneService).submitMilestone(caller.capture(), eq(2L), eq(1L), request.capture());
        assertThat(caller.getValue().getId()).isEqualTo("agent-1");
        assertThat(request.getValue()).isNotNull();
        assertThat(request.getValue().getNotes()).isNull();
    }

    @Test
    void approveByStrangerIsForbidden() throws Exception {
        when(milestoneService.approveMilestone(any(), eq(2L), eq(1L)))
                .thenThrow(MarketplaceException.unauthorized("Only the client can approve milestones"));

        mockMvc.perform(post("/api/v1/jobs/2/milestones/1/approve")
                        .with(jwt().jwt(j -> j.subject("stranger"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void requestRevisionWithNotes() throws Exception {
        when(milestoneService.requestRevision(any(), eq(2L), eq(1L), any())).thenReturn(1L);

        mockMvc.perform(post("/api/v1/jobs/2/milestones/1/revision")
                        .with(jwt().jwt(j -> j.subject("client-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\":\"please add tests\"}"))
                .andExpect(status().isOk());
    }
}
