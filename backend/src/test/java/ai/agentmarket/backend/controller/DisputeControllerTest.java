package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.DisputeFilter;
import ai.agentmarket.backend.model.dto.ResolveDisputeRequest;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.DisputeStatus;
import ai.agentmarket.backend.service.DisputeService;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = DisputeController.class)
@Import({SecurityConfig.class, CallerResolver.class, MarketplaceMetricsService.class})
class DisputeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @SuppressWarnings("removal")
    @MockBean
    private DisputeService disputeService;

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
    @DisplayName("Resolve passes the admin role from the token through to the service")
    void resolveAsAdmin() throws Exception {
        when(disputeService.resolveDispute(any(), eq(5L), any())).thenReturn(5L);

        mockMvc.perform(post("/api/v1/disputes/5/resolve")
                        .with(jwt().jwt(j -> j.subject("moderator"))
                                .authorities(new SimpleGrantedAuthority("ROLE_DISPUTE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"resolved-split\",\"refundPercentage\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5));

        ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
        ArgumentCaptor<ResolveDisputeRequest> request = ArgumentCaptor.forClass(ResolveDisputeRequest.class);
        verify(disputeService).resolveDispute(caller.capture(), eq(5L), request.capture());
        assertThat(caller.getValue().isAdmin()).isTrue();
        assertThat(request.getValue().getResolution()).isEqualTo(DisputeStatus.RESOLVED_SPLIT);
        assertThat(request.getValue().getRefundPercentage()).isEqualTo(50);
    }

    @Test
    void resolveWithoutRoleIsNotAdmin() throws Exception {
        when(disputeService.resolveDispute(any(), eq(5L), any())).thenReturn(5L);

        mockMvc.perform(post("/api/v1/disputes/5/resolve")
                        .with(jwt().jwt(j -> j.subject("client-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resolution\":\"RESOLVED_FOR_CLIENT\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
        verify(disputeService).resolveDispute(caller.capture(), eq(5L), any());
        assertThat(caller.getValue().isAdmin()).isFalse();
    }

    @Test
    void openDisputeOnJob() throws Exception {
        when(disputeService.openDispute(any(), eq(3L), any())).thenReturn(1L);

        mockMvc.perform(post("/api/v1/jobs/3/disputes")
                        .with(jwt().jwt(j -> j.subject("client-1")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"not delivered\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1));
    }

    @Test
    void listDisputesByStatusAndParty() throws Exception {
        when(queryService.disputes(any(DisputeFilter.class))).thenReturn(List.of(Dispute.builder()
                .id(1).jobId(3).initiator("client-1").respondent("agent-1").reason("late").status(DisputeStatus.OPEN).build()));

        mockMvc.perform(get("/api/v1/disputes")
                        .with(jwt().jwt(j -> j.subject("client-1")))
                        .param("status", "open")
                        .param("party", "agent-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].respondent").value("agent-1"))
                .andExpect(jsonPath("$[0].status").value("OPEN"));

        ArgumentCaptor<DisputeFilter> filter = ArgumentCaptor.forClass(DisputeFilter.class);
        verify(queryService).disputes(filter.capture());
        assertThat(filter.getValue().getStatus()).isEqualTo(DisputeStatus.OPEN);
        assertThat(filter.getValue().getParty()).isEqualTo("agent-1");
    }
}
