package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.VerificationRequest;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.service.AgentRegistryService;
import ai.agentmarket.backend.service.ReputationService;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.config.SecurityConfig;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AgentController.class)
@Import({SecurityConfig.class, CallerResolver.class, MarketplaceMetricsService.class})
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @SuppressWarnings("removal")
    @MockBean
    private AgentRegistryService registryService;

    @SuppressWarnings("removal")
    @MockBean
    private ReputationService reputationService;

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

    @Test
    @DisplayName("POST /api/v1/agents registers the caller and returns the owner id")
    void registerAgent() throws Exception {
        when(registryService.registerAgent(any(), any())).thenReturn("agent-1");

        mockMvc.perform(post("/api/v1/agents")
                        .with(jwt().jwt(j -> j.subject("agent-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Scraper Bot\",\"skills\":[\"python\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("agent-1"));
    }

    @Test
    void registerTwiceIsConflict() throws Exception {
        when(registryService.registerAgent(any(), any()))
                .thenThrow(new MarketplaceException(ErrorCode.ALREADY_REGISTERED, "Agent agent-1 is already registered"));

        mockMvc.perform(post("/api/v1/agents")
                        .with(jwt().jwt(j -> j.subject("agent-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Scraper Bot\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_REGISTERED"));
    }

    @Test
    void updateOwnProfile() throws Exception {
        when(registryService.updateAgentProfile(any(), any())).thenReturn("agent-1");

        mockMvc.perform(patch("/api/v1/agents/me")
                        .with(jwt().jwt(j -> j.subject("agent-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"availability\":false}"))
                .andExpect(status().isOk());
    }

    @Test
    void setVerificationLevelAsAdmin() throws Exception {
        when(registryService.setVerificationLevel(any(), eq("agent-1"), any())).thenReturn("agent-1");

        mockMvc.perform(put("/api/v1/agents/agent-1/verification")
                        .with(jwt().jwt(j -> j.subject("moderator"))
                                .authorities(new SimpleGrantedAuthority("ROLE_DISPUTE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\":\"premium\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
        ArgumentCaptor<VerificationRequest> request = ArgumentCaptor.forClass(VerificationRequest.class);
        verify(registryService).setVerificationLevel(caller.capture(), eq("agent-1"), request.capture());
        assertThat(caller.getValue().isAdmin()).isTrue();
        assertThat(request.getValue().getLevel()).isEqualTo(VerificationLevel.PREMIUM);
    }

    @Test
    void rateAgentOnJob() throws Exception {
        when(reputationService.rateAgent(any(), eq(3L), any())).thenReturn(11L);

        mockMvc.perform(post("/api/v1/jobs/3/ratings")
                        .with(jwt().jwt(j -> j.subject("client-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rating\":5,\"review\":\"great\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(11));
    }

    @Test
    void getAgentProfile() throws Exception {
        when(queryService.agent("agent-1")).thenReturn(Optional.of(AgentProfile.builder()
                .owner("agent-1")
                .name("Scraper Bot")
                .skills(List.of("python"))
                .availability(true)
                .totalRatings(2)
                .totalRatingPoints(9)
                .verificationLevel(VerificationLevel.BASIC)
                .build()));
        when(queryService.agent("nobody")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/agents/agent-1").with(jwt().jwt(j -> j.subject("client-1"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Scraper Bot"))
                .andExpect(jsonPath("$.rating").value(4.5))
                .andExpect(jsonPath("$.verificationLevel").value("BASIC"));
        mockMvc.perform(get("/api/v1/agents/nobody").with(jwt().jwt(j -> j.subject("client-1"))))
                .andExpect(status().isNotFound());
    }
}
