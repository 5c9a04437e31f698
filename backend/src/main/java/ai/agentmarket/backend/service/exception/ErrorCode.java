package ai.agentmarket.backend.service.exception;

/**
 * Typed failure kinds reported by the marketplace ledger.
 */
public enum ErrorCode {
    NOT_FOUND,
    BID_NOT_FOUND,
    UNAUTHORIZED,
    INVALID_STATE,
    INVALID_AMOUNT,
    INVALID_MILESTONES,
    INVALID_ARGUMENT,
    DUPLICATE_BID,
    DUPLICATE_RATING,
    ALREADY_REGISTERED,
    ALREADY_FUNDED,
    ALREADY_RESOLVED,
    INSUFFICIENT_ESCROW,
    NO_AGENT
}
