package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.StaleRecordException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Commits a mutation's change set and, once it is durable, publishes its events.
 *
 * Lost optimistic races become INVALID_STATE, except when two callers raced to create the same
 * bid, agent or rating, which surfaces as the matching duplicate error.
 */
@Slf4j
@Component
public class LedgerCommitter {

    private final LedgerStore ledgerStore;
    private final ApplicationEventPublisher eventPublisher;

    public LedgerCommitter(LedgerStore ledgerStore, ApplicationEventPublisher eventPublisher) {
        this.ledgerStore = ledgerStore;
        this.eventPublisher = eventPublisher;
    }

    public void commit(String operation, LedgerTransaction transaction) {
        try {
            ledgerStore.commit(transaction);
        } catch (StaleRecordException e) {
            log.warn("{} lost a concurrent update on {}", operation, e.getConflictKey());
            throw translate(e);
        }

        for (MarketplaceEvent event : transaction.getEvents()) {
            eventPublisher.publishEvent(event);
        }
    }

    private MarketplaceException translate(StaleRecordException e) {
        if (e.isCreateConflict()) {
            switch (e.getRecordType()) {
                case BID:
                    return new MarketplaceException(ErrorCode.DUPLICATE_BID, "A bid from this agent already exists", e);
                case AGENT:
                    return new MarketplaceException(ErrorCode.ALREADY_REGISTERED, "Agent is already registered", e);
                case RATING:
                    return new MarketplaceException(ErrorCode.DUPLICATE_RATING, "This job was already rated by the caller", e);
                default:
                    break;
            }
        }
        return new MarketplaceException(ErrorCode.INVALID_STATE,
                "Record " + e.getConflictKey() + " was modified concurrently", e);
    }
}
