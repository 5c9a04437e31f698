package ai.agentmarket.backend.event;

public enum MarketplaceEventType {
    JOB_POSTED,
    BID_PLACED,
    BID_ACCEPTED,
    JOB_COMPLETED,
    JOB_CANCELLED,
    ESCROW_FUNDED,
    PAYMENT_RELEASED,
    PAYMENT_REFUNDED,
    MILESTONE_SUBMITTED,
    MILESTONE_APPROVED,
    REVISION_REQUESTED,
    DISPUTE_OPENED,
    DISPUTE_RESPONDED,
    DISPUTE_RESOLVED,
    AGENT_RATED,
    MESSAGE_SENT
}
