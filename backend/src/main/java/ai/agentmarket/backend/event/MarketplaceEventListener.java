package ai.agentmarket.backend.event;

import ai.agentmarket.backend.service.MarketplaceMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Delivers post-commit notifications to the affected party and feeds escrow volume metrics.
 * Handling is idempotent: an event id seen before is ignored.
 */
@Slf4j
@Component
public class MarketplaceEventListener {

    private static final int MAX_REMEMBERED_EVENTS = 10_000;

    private final MarketplaceMetricsService metricsService;

    private final Set<String> handledEventIds = Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>(256, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > MAX_REMEMBERED_EVENTS;
                }
            });

    public MarketplaceEventListener(MarketplaceMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    @EventListener
    public void onMarketplaceEvent(MarketplaceEvent event) {
        handle(event);
    }

    /**
     * @return true if the event was handled, false if it had already been seen
     */
    boolean handle(MarketplaceEvent event) {
        synchronized (handledEventIds) {
            if (!handledEventIds.add(event.getEventId())) {
                log.debug("Ignoring duplicate event {}", event.getEventId());
                return false;
            }
        }

        metricsService.incrementEventCounter(event.getType().name());
        switch (event.getType()) {
            case PAYMENT_RELEASED -> metricsService.recordDisbursement("release", event.getAmount());
            case PAYMENT_REFUNDED -> metricsService.recordDisbursement("refund", event.getAmount());
            default -> {
            }
        }

        if (event.getCounterparty() != null) {
            log.info("Notify {}: {} on job {} by {}{}", event.getCounterparty(), event.getType(), event.getJobId(),
                    event.getActor(), event.getAmount() == null ? "" : " (amount " + event.getAmount().toPlainString() + ")");
        }
        return true;
    }
}
