package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.AcceptBidRequest;
import ai.agentmarket.backend.model.dto.JobFilter;
import ai.agentmarket.backend.model.dto.JobSortField;
import ai.agentmarket.backend.model.dto.JobView;
import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.dto.PlaceBidRequest;
import ai.agentmarket.backend.model.dto.PostJobRequest;
import ai.agentmarket.backend.model.dto.SortDirection;
import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.JobLedgerService;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.util.Amounts;
import ai.agentmarket.backend.util.EnumTokens;
import io.micrometer.core.annotation.Timed;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
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
import java.util.Map;

/**
 * REST controller for the job ledger: posting, bidding, acceptance, completion and job queries.
 * All endpoints require JWT authentication; the token subject is the caller.
 */
@RestController
@RequestMapping("/api/v1")
public class JobController {

    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final JobLedgerService jobLedgerService;
    private final MarketplaceQueryService queryService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    @Autowired
    public JobController(JobLedgerService jobLedgerService, MarketplaceQueryService queryService,
                         CallerResolver callerResolver, MarketplaceMetricsService metricsService) {
        this.jobLedgerService = jobLedgerService;
        this.queryService = queryService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    /**
     * Lists jobs matching the optional filters, sorted and paged.
     */
    @Timed(value = "http_request_duration_seconds", description = "Job listing request duration", extraTags = {"endpoint", "/api/v1/jobs", "operation", "list_jobs"})
    @GetMapping("/jobs")
    public ResponseEntity<List<JobView>> listJobs(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String minPayment,
            @RequestParam(required = false) String maxPayment,
            @RequestParam(required = false) String client,
            @RequestParam(required = false) String agent,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortDir,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        JobFilter filter = JobFilter.builder()
                .status(EnumTokens.parseOptional(JobStatus.class, status))
                .minPayment(Amounts.parseOptionalFilter(minPayment, "minPayment"))
                .maxPayment(Amounts.parseOptionalFilter(maxPayment, "maxPayment"))
                .client(client)
                .agent(agent)
                .category(EnumTokens.parseOptional(JobCategory.class, category))
                .tag(tag)
                .build();
        List<JobView> jobs = queryService.jobs(filter,
                EnumTokens.parseOptional(JobSortField.class, sortBy),
                EnumTokens.parseOptional(SortDirection.class, sortDir),
                limit, offset);
        logger.debug("Listed {} job(s)", jobs.size());
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobView> getJob(@PathVariable long jobId) {
        return ResponseEntity.ok(queryService.job(jobId)
                .orElseThrow(() -> MarketplaceException.notFound("Job", jobId)));
    }

    @GetMapping("/jobs/search")
    public ResponseEntity<List<JobView>> searchJobs(@RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(queryService.searchJobs(query));
    }

    @GetMapping("/jobs/category/{category}")
    public ResponseEntity<List<JobView>> jobsByCategory(@PathVariable String category) {
        return ResponseEntity.ok(queryService.jobsByCategory(EnumTokens.parse(JobCategory.class, category)));
    }

    @GetMapping("/jobs/count")
    public ResponseEntity<Map<String, Long>> jobsCount(@RequestParam(required = false) String status) {
        long count = queryService.jobsCount(EnumTokens.parseOptional(JobStatus.class, status));
        return ResponseEntity.ok(Map.of("count", count));
    }

    /**
     * Posts a new job with an unfunded escrow.
     */
    @Timed(value = "http_request_duration_seconds", description = "Job posting request duration", extraTags = {"endpoint", "/api/v1/jobs", "operation", "post_job"})
    @PostMapping("/jobs")
    public ResponseEntity<MutationResponse> postJob(Authentication authentication, @Valid @RequestBody PostJobRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received postJob request from user: {}", caller.getId());
        long jobId = metricsService.recordMutation("post_job", () -> jobLedgerService.postJob(caller, request));
        return ResponseEntity.ok(MutationResponse.of(jobId));
    }

    @Timed(value = "http_request_duration_seconds", description = "Bid placement request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/bids", "operation", "place_bid"})
    @PostMapping("/jobs/{jobId}/bids")
    public ResponseEntity<MutationResponse> placeBid(Authentication authentication, @PathVariable long jobId,
                                                     @Valid @RequestBody PlaceBidRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received placeBid request on job {} from user: {}", jobId, caller.getId());
        long bidId = metricsService.recordMutation("place_bid", () -> jobLedgerService.placeBid(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(bidId));
    }

    @Timed(value = "http_request_duration_seconds", description = "Bid acceptance request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/accept", "operation", "accept_bid"})
    @PostMapping("/jobs/{jobId}/accept")
    public ResponseEntity<MutationResponse> acceptBid(Authentication authentication, @PathVariable long jobId,
                                                      @Valid @RequestBody AcceptBidRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received acceptBid request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("accept_bid", () -> jobLedgerService.acceptBid(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Job completion request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/complete", "operation", "complete_job"})
    @PostMapping("/jobs/{jobId}/complete")
    public ResponseEntity<MutationResponse> completeJob(Authentication authentication, @PathVariable long jobId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received completeJob request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("complete_job", () -> jobLedgerService.completeJob(caller, jobId));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @Timed(value = "http_request_duration_seconds", description = "Job cancellation request duration", extraTags = {"endpoint", "/api/v1/jobs/{jobId}/cancel", "operation", "cancel_job"})
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<MutationResponse> cancelJob(Authentication authentication, @PathVariable long jobId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        logger.info("Received cancelJob request on job {} from user: {}", jobId, caller.getId());
        long id = metricsService.recordMutation("cancel_job", () -> jobLedgerService.cancelJob(caller, jobId));
        return ResponseEntity.ok(MutationResponse.of(id));
    }
}
