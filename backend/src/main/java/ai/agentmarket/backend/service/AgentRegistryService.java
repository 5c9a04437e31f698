package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.dto.RegisterAgentRequest;
import ai.agentmarket.backend.model.dto.UpdateAgentProfileRequest;
import ai.agentmarket.backend.model.dto.VerificationRequest;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.util.Amounts;
import ai.agentmarket.backend.util.Inputs;
import ai.agentmarket.backend.util.SecurityUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Agent registration and profile maintenance. One profile per owner principal.
 */
@Slf4j
@Service
public class AgentRegistryService {

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final Clock clock;

    public AgentRegistryService(LedgerStore ledgerStore, LedgerCommitter committer, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.clock = clock;
    }

    /**
     * @return the owner id of the new profile
     */
    public String registerAgent(CallerIdentity caller, RegisterAgentRequest request) {
        String name = Inputs.requireText(request.getName(), "Name");
        if (ledgerStore.agent(caller.getId()).isPresent()) {
            throw new MarketplaceException(ErrorCode.ALREADY_REGISTERED, "Agent " + caller.getId() + " is already registered");
        }

        Instant now = clock.instant();
        AgentProfile profile = AgentProfile.builder()
                .owner(caller.getId())
                .name(name)
                .serviceDescription(Inputs.optionalText(request.getServiceDescription()))
                .skills(Inputs.distinctTokens(request.getSkills()))
                .portfolioUrls(validatedUrls(request.getPortfolioUrls()))
                .hourlyRate(Amounts.parseOptionalPositive(request.getHourlyRate(), "Hourly rate"))
                .availability(true)
                .verificationLevel(VerificationLevel.UNVERIFIED)
                .registeredAt(now)
                .updatedAt(now)
                .build();

        // version 0 makes a racing second registration fail as a create conflict
        committer.commit("register_agent", new LedgerTransaction().save(profile));
        log.info("Agent {} registered as '{}'", caller.getId(), SecurityUtils.sanitizeForLogging(name));
        return caller.getId();
    }

    /**
     * Applies the non-null fields of the request to the caller's own profile.
     *
     * @return the owner id
     */
    public String updateAgentProfile(CallerIdentity caller, UpdateAgentProfileRequest request) {
        AgentProfile profile = ledgerStore.agent(caller.getId())
                .orElseThrow(() -> MarketplaceException.notFound("Agent", caller.getId()));

        if (request.getName() != null) {
            profile.setName(Inputs.requireText(request.getName(), "Name"));
        }
        if (request.getServiceDescription() != null) {
            profile.setServiceDescription(Inputs.optionalText(request.getServiceDescription()));
        }
        if (request.getSkills() != null) {
            profile.setSkills(Inputs.distinctTokens(request.getSkills()));
        }
        if (request.getPortfolioUrls() != null) {
            profile.setPortfolioUrls(validatedUrls(request.getPortfolioUrls()));
        }
        if (request.getHourlyRate() != null) {
            profile.setHourlyRate(Amounts.parsePositive(request.getHourlyRate(), "Hourly rate"));
        }
        if (request.getAvailability() != null) {
            profile.setAvailability(request.getAvailability());
        }
        profile.setUpdatedAt(clock.instant());

        committer.commit("update_agent_profile", new LedgerTransaction().save(profile));
        log.info("Agent profile {} updated", caller.getId());
        return caller.getId();
    }

    /**
     * Admin-only change of an agent's verification tier.
     *
     * @return the owner id
     */
    public String setVerificationLevel(CallerIdentity caller, String owner, VerificationRequest request) {
        if (!caller.isAdmin()) {
            throw MarketplaceException.unauthorized("Only admins can change verification levels");
        }
        if (request.getLevel() == null) {
            throw MarketplaceException.invalidArgument("Verification level is required");
        }
        AgentProfile profile = ledgerStore.agent(owner)
                .orElseThrow(() -> MarketplaceException.notFound("Agent", owner));
        profile.setVerificationLevel(request.getLevel());
        profile.setUpdatedAt(clock.instant());

        committer.commit("set_verification_level", new LedgerTransaction().save(profile));
        log.info("Agent {} verification set to {} by {}", owner, request.getLevel(), caller.getId());
        return owner;
    }

    private List<String> validatedUrls(List<String> urls) {
        List<String> cleaned = Inputs.distinctTokens(urls);
        for (String url : cleaned) {
            if (!SecurityUtils.isSafeUrl(url)) {
                throw MarketplaceException.invalidArgument("Portfolio URL is not a valid http(s) URL: "
                        + SecurityUtils.sanitizeForLogging(url));
            }
        }
        return cleaned;
    }
}
