package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.MilestoneSubmissionRequest;
import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.dto.RevisionRequest;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MilestoneService;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Milestone submission and review on in-progress jobs.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs/{jobId}/milestones/{milestoneId}")
public class MilestoneController {

    private final MilestoneService milestoneService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    public MilestoneController(MilestoneService milestoneService, CallerResolver callerResolver,
                               MarketplaceMetricsService metricsService) {
        this.milestoneService = milestoneService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    @Timed(value = "http_request_duration_seconds", description = "Milestone submission request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/milestones/{milestoneId}/submit", "operation", "submit_milestone"})
    @PostMapping("/submit")
    public ResponseEntity<MutationResponse> submit(Authentication authentication, @PathVariable long jobId,
                                                   @PathVariable long milestoneId,
                                                   @Valid @RequestBody(required = false) MilestoneSubmissionRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        MilestoneSubmissionRequest body = request == null ? new MilestoneSubmissionRequest() : request;
        long id = metricsService.recordMutation("submit_milestone",
                () -> milestoneService.submitMilestone(caller, jobId, milestoneId, body));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Milestone approval request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/milestones/{milestoneId}/approve", "operation", "approve_milestone"})
    @PostMapping("/approve")
    public ResponseEntity<MutationResponse> approve(Authentication authentication, @PathVariable long jobId,
                                                    @PathVariable long milestoneId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        log.info("Received approveMilestone request for milestone {} of job {} from user: {}", milestoneId, jobId, caller.getId());
        long id = metricsService.recordMutation("approve_milestone",
                () -> milestoneService.approveMilestone(caller, jobId, milestoneId));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Revision request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/milestones/{milestoneId}/revision", "operation", "request_revision"})
    @PostMapping("/revision")
    public ResponseEntity<MutationResponse> requestRevision(Authentication authentication, @PathVariable long jobId,
                                                            @PathVariable long milestoneId,
                                                            @Valid @RequestBody(required = false) RevisionRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        RevisionRequest body = request == null ? new RevisionRequest() : request;
        long id = metricsService.recordMutation("request_revision",
                () -> milestoneService.requestRevision(caller, jobId, milestoneId, body));
        return ResponseEntity.ok(MutationResponse.of(id));
    }
}
