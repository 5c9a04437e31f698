package ai.agentmarket.backend.controller;

import ai.agentmarket.backend.model.dto.MutationResponse;
import ai.agentmarket.backend.model.dto.SendMessageRequest;
import ai.agentmarket.backend.model.dto.UpdatedCountResponse;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.security.CallerResolver;
import ai.agentmarket.backend.service.MarketplaceMetricsService;
import ai.agentmarket.backend.service.MarketplaceQueryService;
import ai.agentmarket.backend.service.MessagingService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class MessageController {

    private final MessagingService messagingService;
    private final MarketplaceQueryService queryService;
    private final CallerResolver callerResolver;
    private final MarketplaceMetricsService metricsService;

    public MessageController(MessagingService messagingService, MarketplaceQueryService queryService,
                             CallerResolver callerResolver, MarketplaceMetricsService metricsService) {
        this.messagingService = messagingService;
        this.queryService = queryService;
        this.callerResolver = callerResolver;
        this.metricsService = metricsService;
    }

    @GetMapping("/jobs/{jobId}/messages")
    public ResponseEntity<List<ChatMessage>> jobMessages(Authentication authentication, @PathVariable long jobId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        return ResponseEntity.ok(queryService.jobMessages(caller, jobId));
    }

    @GetMapping("/messages/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount(Authentication authentication) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        return ResponseEntity.ok(Map.of("count", queryService.unreadMessagesCount(caller)));
    }

    @PostMapping("/jobs/{jobId}/messages")
    public ResponseEntity<MutationResponse> sendMessage(Authentication authentication, @PathVariable long jobId,
                                                        @Valid @RequestBody SendMessageRequest request) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        long id = metricsService.recordMutation("send_message", () -> messagingService.sendMessage(caller, jobId, request));
        return ResponseEntity.ok(MutationResponse.of(id));
    }

    @PostMapping("/jobs/{jobId}/messages/read")
    public ResponseEntity<UpdatedCountResponse> markRead(Authentication authentication, @PathVariable long jobId) {
        CallerIdentity caller = callerResolver.resolve(authentication);
        int updated = metricsService.recordMutation("mark_messages_read", () -> messagingService.markMessagesRead(caller, jobId));
        return ResponseEntity.ok(new UpdatedCountResponse(updated));
    }
}
