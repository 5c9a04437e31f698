package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.AgentFilter;
import ai.agentmarket.backend.model.dto.AgentSortField;
import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.dto.RateAgentRequest;
import ai.agentmarket.backend.model.dto.RegisterAgentRequest;
import ai.agentmarket.backend.model.dto.SortDirection;
import ai.agentmarket.backend.model.dto.UpdateAgentProfileRequest;
import ai.agentmarket.backend.model.dto.VerificationRequest;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.Rating;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.AgentRegistryService;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import ai.agentmarket.backend.service.ReputationService;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.util.EnumTokens;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for agent profiles, verification and ratings.
 */
@RestController
@RequestMapping("/api/v1")
public class AgentController {

    private static final Logger logger = LoggerFactory.getLogger(AgentController.class);

    private final AgentRegistryService registryService;
    private final ReputationService reputationService;
    private final MarketplaceQueryService queryService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    @Autowired
    public AgentController(AgentRegistryService registryService, ReputationService reputationService,
                           MarketplaceQueryService queryService, CallerResolver callerResolver,
                           MarketplaceMetricsService metricsService) {
        this.registryService = registryService;
        this.reputationService = reputationService;
        this.queryService = queryService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    @Timed(value = "http_request_duration_seconds", description = "Agent listing request duration", extraTags = {"endpoint", "/api/v1/agents", "operation", "list_agents"})
    @GetMapping("/agents")
    public ResponseEntity<List<AgentProfile>> listAgents(
            @RequestParam(required = false) Long minJobsCompleted,
            @RequestParam(required = false) Double minRating,
            @RequestParam(required = false) String skill,
            @RequestParam(required = false) Boolean available,
            @RequestParam(required = false) String minVerificationLevel,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDir,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        AgentFilter filter = AgentFilter.builder()
                .minJobsCompleted(minJobsCompleted)
                .minRating(minRating)
                .skill(skill)
                .available(available)
                .minVerificationLevel(EnumTokens.parseOptional(VerificationLevel.class, minVerificationLevel))
                .build();
        return ResponseEntity.ok(queryService.agents(filter,
                EnumTokens.parseOptional(AgentSortField.class, sortBy),
                EnumTokens.parseOptional(SortDirection.class, sortDir),
                limit, offset));
    }

    @GetMapping("/agents/{owner}")
    public ResponseEntity<AgentProfile> getAgent(@PathVariable String owner) {
        return ResponseEntity.ok(queryService.agent(owner)
                .orElseThrow(() -> MarketplaceException.notFound("Agent", owner)));
    }

    @GetMapping("/agents/skill/{skill}")
    public ResponseEntity<List<AgentProfile>> agentsBySkill(@PathVariable String skill) {
        return ResponseEntity.ok(queryService.agentsBySkill(skill));
    }

    @GetMapping("/agents/verified")
    public ResponseEntity<List<AgentProfile>> verifiedAgents(@RequestParam(required = false) String minLevel) {
        return ResponseEntity.ok(queryService.verifiedAgents(EnumTokens.parseOptional(VerificationLevel.class, minLevel)));
    }

    @GetMapping("/agents/{owner}/ratings")
    public ResponseEntity<List<Rating>> agentRatings(@PathVariable String owner) {
        return ResponseEntity.ok(queryService.agentRatings(owner));
    }

    @Timed(value = "http_request_duration_seconds", description = "Agent registration request duration", extraTags = {"endpoint", "/api/v1/agents", "operation", "register_agent"})
    @PostMapping("/agents")
    public ResponseEntity<MutationResponse> registerAgent(Authentication authentication,
                                                          @Valid @RequestBody RegisterAgentRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received registerAgent request from user: {}", caller.getId());
        String owner = metricsService.recordMutation("register_agent", () -> registryService.registerAgent(caller, request));
        return ResponseEntity.ok(MutationResponse.of(owner));
    }

    @Timed(value = "http_request_duration_seconds", description = "Agent profile update request duration", extraTags = {"endpoint", "/api/v1/agents/me", "operation", "update_agent_profile"})
    @PatchMapping("/agents/me")
    public ResponseEntity<MutationResponse> updateProfile(Authentication authentication,
                                                          @Valid @RequestBody UpdateAgentProfileRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        String owner = metricsService.recordMutation("update_agent_profile",
                () -> registryService.updateAgentProfile(caller, request));
        return ResponseEntity.ok(MutationResponse.of(owner));
    }

    @Timed(value = "http_request_duration_seconds", description = "Verification change request duration", extraTags = {"endpoint", "/api/v1/agents/{owner}/verification", "operation", "set_verification_level"})
    @PutMapping("/agents/{owner}/verification")
    public ResponseEntity<MutationResponse> setVerificationLevel(Authentication authentication, @PathVariable String owner,
                                                                 @Valid @RequestBody VerificationRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received setVerificationLevel request for {} from user: {}", owner, caller.getId());
        String id = metricsService.recordMutation("set_verification_level",
                () -> registryService.setVerificationLevel(caller, owner, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Rating request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/ratings", "operation", "rate_agent"})
    @PostMapping("/jobs/{jobId}/ratings")
    public ResponseEntity<MutationResponse> rateAgent(Authentication authentication, @PathVariable long jobId,
                                                      @Valid @RequestBody RateAgentRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received rateAgent request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("rate_agent", () -> reputationService.rateAgent(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }
}
