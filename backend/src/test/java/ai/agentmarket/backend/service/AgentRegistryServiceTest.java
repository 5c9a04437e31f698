package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.dto.RegisterAgentRequest;
import ai.agentmarket.backend.model.dto.UpdateAgentProfileRequest;
import ai.agentmarket.backend.model.dto.VerificationRequest;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.service.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ai.agentmarket.backend.service.JobLedgerServiceImplTest.assertCode;
import static ai.agentmarket.backend.service.MarketplaceFixture.ADMIN;
import static ai.agentmarket.backend.service.MarketplaceFixture.AGENT;
import static org.assertj.core.api.Assertions.assertThat;

class AgentRegistryServiceTest {

    private MarketplaceFixture fx;

    @BeforeEach
    void setUp() {
        fx = new MarketplaceFixture();
    }

    @Test
    void registerCreatesAvailableUnverifiedProfile() {
        String owner = fx.agents.registerAgent(AGENT, RegisterAgentRequest.builder()
                .name("  Scraper Bot ")
                .skills(List.of("Python", "python", " scraping "))
                .portfolioUrls(List.of("https://example.com/work"))
                .hourlyRate("25.50")
                .build());

        AgentProfile profile = fx.store.snapshot().agent(owner).orElseThrow();
        assertThat(owner).isEqualTo("agent-1");
        assertThat(profile.getName()).isEqualTo("Scraper Bot");
        assertThat(profile.getSkills()).containsExactly("Python", "scraping");
        assertThat(profile.getHourlyRate()).isEqualByComparingTo("25.5");
        assertThat(profile.isAvailability()).isTrue();
        assertThat(profile.getVerificationLevel()).isEqualTo(VerificationLevel.UNVERIFIED);
        assertThat(profile.getRating()).isZero();
    }

    @Test
    void registerTwiceFails() {
        fx.register(AGENT);

        assertCode(() -> fx.register(AGENT), ErrorCode.ALREADY_REGISTERED);
    }

    @Test
    void registerRejectsUnsafeUrlsAndMissingName() {
        assertCode(() -> fx.agents.registerAgent(AGENT, RegisterAgentRequest.builder()
                .name("bot").portfolioUrls(List.of("javascript:alert(1)")).build()), ErrorCode.INVALID_ARGUMENT);
        assertCode(() -> fx.agents.registerAgent(AGENT, RegisterAgentRequest.builder().build()), ErrorCode.INVALID_ARGUMENT);
        assertThat(fx.store.snapshot().agents()).isEmpty();
    }

    @Test
    void updateAppliesOnlyGivenFields() {
        fx.register(AGENT);

        fx.agents.updateAgentProfile(AGENT, UpdateAgentProfileRequest.builder()
                .availability(false)
                .hourlyRate("40")
                .build());

        AgentProfile profile = fx.store.snapshot().agent("agent-1").orElseThrow();
        assertThat(profile.isAvailability()).isFalse();
        assertThat(profile.getHourlyRate()).isEqualByComparingTo("40");
        assertThat(profile.getName()).isEqualTo("Agent agent-1");
        assertThat(profile.getSkills()).containsExactly("java", "spring");
    }

    @Test
    void updateUnregisteredFails() {
        assertCode(() -> fx.agents.updateAgentProfile(AGENT, new UpdateAgentProfileRequest()), ErrorCode.NOT_FOUND);
    }

    @Test
    void verificationIsAdminOnly() {
        fx.register(AGENT);
        VerificationRequest request = VerificationRequest.builder().level(VerificationLevel.PREMIUM).build();

        assertCode(() -> fx.agents.setVerificationLevel(AGENT, "agent-1", request), ErrorCode.UNAUTHORIZED);
        assertCode(() -> fx.agents.setVerificationLevel(ADMIN, "nobody", request), ErrorCode.NOT_FOUND);

        fx.agents.setVerificationLevel(ADMIN, "agent-1", request);
        assertThat(fx.store.snapshot().agent("agent-1").orElseThrow().getVerificationLevel())
                .isEqualTo(VerificationLevel.PREMIUM);
    }
}
