package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.MarketplaceStats;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import io.micrometer.core.annotation.Timed;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class StatsController {

    private final MarketplaceQueryService queryService;

    public StatsController(MarketplaceQueryService queryService) {
        this.queryService = queryService;
    }

    @Timed(value = "http_request_duration_seconds", description = "Marketplace stats request duration", extraTags = {"endpoint", "/api/v1/stats", "operation", "stats"})
    @GetMapping("/stats")
    public ResponseEntity<MarketplaceStats> stats() {
        return ResponseEntity.ok(queryService.stats());
    }
}
