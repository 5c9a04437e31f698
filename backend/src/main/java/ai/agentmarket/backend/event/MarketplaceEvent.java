package ai.agentmarket.backend.event;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Something that happened in the ledger and concerns a party other than the caller,
 * e.g. an agent whose bid was accepted or who received a payment.
 * Published only after the mutation that produced it has been committed.
 */
@Value
@Builder
public class MarketplaceEvent {

    /**
     * Unique per event; consumers use it to drop redeliveries.
     */
    String eventId;

    MarketplaceEventType type;

    long jobId;

    String actor;

    /**
     * The party to notify, when there is one.
     */
    String counterparty;

    BigDecimal amount;

    Instant occurredAt;

    public static MarketplaceEvent of(MarketplaceEventType type, long jobId, String actor, String counterparty,
                                      BigDecimal amount, Instant occurredAt) {
        return MarketplaceEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .jobId(jobId)
                .actor(actor)
                .counterparty(counterparty)
                .amount(amount)
                .occurredAt(occurredAt)
                .build();
    }
}
