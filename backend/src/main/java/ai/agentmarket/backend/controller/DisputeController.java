package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.DisputeFilter;
import ai.agentmarket.backend.model.dto.DisputeResponseRequest;
import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.dto.OpenDisputeRequest;
import ai.agentmarket.backend.model.dto.ResolveDisputeRequest;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.DisputeStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.DisputeService;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.util.EnumTokens;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Dispute lifecycle. Resolution is restricted to dispute admins.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class DisputeController {

    private final DisputeService disputeService;
    private final MarketplaceQueryService queryService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    public DisputeController(DisputeService disputeService, MarketplaceQueryService queryService,
                             CallerResolver callerResolver, MarketplaceMetricsService metricsService) {
        this.disputeService = disputeService;
        this.queryService = queryService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    @GetMapping("/disputes")
    public ResponseEntity<List<Dispute>> listDisputes(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Long jobId,
            @RequestParam(required = false) String party) {
        DisputeFilter filter = DisputeFilter.builder()
                .status(EnumTokens.parseOptional(DisputeStatus.class, status))
                .jobId(jobId)
                .party(party)
                .build();
        return ResponseEntity.ok(queryService.disputes(filter));
    }

    @GetMapping("/disputes/{disputeId}")
    public ResponseEntity<Dispute> getDispute(@PathVariable long disputeId) {
        return ResponseEntity.ok(queryService.dispute(disputeId)
                .orElseThrow(() -> MarketplaceException.notFound("Dispute", disputeId)));
    }

    @Timed(value = "http_request_duration_seconds", description = "Dispute opening request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/disputes", "operation", "open_dispute"})
    @PostMapping("/jobs/{jobId}/disputes")
    public ResponseEntity<MutationResponse> openDispute(Authentication authentication, @PathVariable long jobId,
                                                        @Valid @RequestBody OpenDisputeRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        log.info("Received openDispute request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("open_dispute", () -> disputeService.openDispute(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Dispute response request duration", extraTags = {"endpoint", "/api/v1/disputes/{disputeId}/respond", "operation", "respond_to_dispute"})
    @PostMapping("/disputes/{disputeId}/respond")
    public ResponseEntity<MutationResponse> respond(Authentication authentication, @PathVariable long disputeId,
                                                    @Valid @RequestBody DisputeResponseRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        long id = metricsService.recordMutation("respond_to_dispute",
                () -> disputeService.respondToDispute(caller, disputeId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Dispute resolution request duration", extraTags = {"endpoint", "/api/v1/disputes/{disputeId}/resolve", "operation", "resolve_dispute"})
    @PostMapping("/disputes/{disputeId}/resolve")
    public ResponseEntity<MutationResponse> resolve(Authentication authentication, @PathVariable long disputeId,
                                                    @Valid @RequestBody ResolveDisputeRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        log.info("Received resolveDispute request for dispute {} from user: {}", disputeId, caller.getId());
        long id = metricsService.recordMutation("resolve_dispute",
                () -> disputeService.resolveDispute(caller, disputeId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }
}
