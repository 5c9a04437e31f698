package ai.agentmarket.backend.service.exception;

import lombok.Getter;

/**
 * Raised when a marketplace operation is rejected.
 * A rejected mutation never leaves partial changes in the ledger.
 */
@Getter
public class MarketplaceException extends RuntimeException {

    private final ErrorCode errorCode;

    public MarketplaceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MarketplaceException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static MarketplaceException notFound(String what, Object id) {
        return new MarketplaceException(ErrorCode.NOT_FOUND, what + " not found: " + id);
    }

    public static MarketplaceException unauthorized(String message) {
        return new MarketplaceException(ErrorCode.UNAUTHORIZED, message);
    }

    public static MarketplaceException invalidState(String message) {
        return new MarketplaceException(ErrorCode.INVALID_STATE, message);
    }

    public static MarketplaceException invalidAmount(String message) {
        return new MarketplaceException(ErrorCode.INVALID_AMOUNT, message);
    }

    public static MarketplaceException invalidArgument(String message) {
        return new MarketplaceException(ErrorCode.INVALID_ARGUMENT, message);
    }
}
