package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.EscrowAmountRequest;
import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.EscrowService;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import ai.agentmarket.backend.service.exception.MarketplaceException;
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
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1")
public class EscrowController {

    private final EscrowService escrowService;
    private final MarketplaceQueryService queryService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    public EscrowController(EscrowService escrowService, MarketplaceQueryService queryService,
                            CallerResolver callerResolver, MarketplaceMetricsService metricsService) {
        this.escrowService = escrowService;
        this.queryService = queryService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    @GetMapping("/jobs/{jobId}/escrow")
    public ResponseEntity<EscrowRecord> getEscrow(@PathVariable long jobId) {
        return ResponseEntity.ok(queryService.escrow(jobId)
                .orElseThrow(() -> MarketplaceException.notFound("Escrow for job", jobId)));
    }

    @GetMapping("/escrows/active")
    public ResponseEntity<List<EscrowRecord>> activeEscrows() {
        return ResponseEntity.ok(queryService.activeEscrows());
    }

    @Timed(value = "http_request_duration_seconds", description = "Escrow funding request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/escrow/fund", "operation", "fund_escrow"})
    @PostMapping("/jobs/{jobId}/escrow/fund")
    public ResponseEntity<MutationResponse> fund(Authentication authentication, @PathVariable long jobId,
                                                 @Valid @RequestBody EscrowAmountRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        log.info("Received fundEscrow request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("fund_escrow", () -> escrowService.fundEscrow(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Escrow release request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/escrow/release", "operation", "release_escrow"})
    @PostMapping("/jobs/{jobId}/escrow/release")
    public ResponseEntity<MutationResponse> release(Authentication authentication, @PathVariable long jobId,
                                                    @Valid @RequestBody EscrowAmountRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        log.info("Received releaseEscrow request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("release_escrow", () -> escrowService.releaseEscrow(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }
}
