package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.EscrowStatus;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.util.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Money movements on an {@link EscrowRecord}.
 *
 * Operates on a record copy read from the store; the caller stages the copy in its transaction.
 * Invariant kept by every method: released + refunded never exceeds the locked amount.
 * After acceptance the locked amount is the accepted bid.
 */
@Component
public class EscrowManager {

    /**
     * Locks funds on an unfunded escrow.
     *
     * @throws MarketplaceException ALREADY_FUNDED unless the escrow is unfunded, INVALID_AMOUNT for amount <= 0
     */
    public void lock(EscrowRecord escrow, BigDecimal amount, Instant now) {
        if (escrow.getStatus() != EscrowStatus.UNFUNDED) {
            throw new MarketplaceException(ErrorCode.ALREADY_FUNDED, "Escrow for job " + escrow.getJobId() + " is already funded");
        }
        BigDecimal locked = Amounts.requirePositive(amount, "Escrow amount");
        escrow.setAmount(locked);
        escrow.setReleasedAmount(BigDecimal.ZERO);
        escrow.setRefundedAmount(BigDecimal.ZERO);
        escrow.setStatus(EscrowStatus.LOCKED);
        escrow.setLockedAt(now);
    }

    /**
     * Client pre-funding of a posted job. Locks the amount and remembers it as the funded figure.
     */
    public void fund(EscrowRecord escrow, BigDecimal amount, Instant now) {
        lock(escrow, amount, now);
        escrow.setFundedAmount(escrow.getAmount());
    }

    /**
     * Binds the escrow to the accepted agent and makes sure exactly the bid amount is held.
     * An unfunded escrow is locked at the bid amount. A pre-funded escrow must cover the bid; the
     * locked amount drops to the bid and the surplus goes back to the client.
     *
     * @return the surplus refunded to the client, zero if none
     */
    public BigDecimal lockForAcceptance(EscrowRecord escrow, String agent, BigDecimal bidAmount, Instant now) {
        BigDecimal surplus = BigDecimal.ZERO;
        if (escrow.getStatus() == EscrowStatus.UNFUNDED) {
            lock(escrow, bidAmount, now);
        } else if (isUntouchedLock(escrow)) {
            BigDecimal funded = escrow.getAmount();
            if (funded.compareTo(bidAmount) < 0) {
                throw new MarketplaceException(ErrorCode.INSUFFICIENT_ESCROW,
                        "Escrow holds " + funded.toPlainString() + " but the bid is " + bidAmount.toPlainString());
            }
            surplus = Amounts.normalize(funded.subtract(bidAmount));
            escrow.setFundedAmount(funded);
            escrow.setSurplusRefunded(surplus);
            escrow.setAmount(Amounts.normalize(bidAmount));
        } else {
            throw new MarketplaceException(ErrorCode.ALREADY_FUNDED, "Escrow for job " + escrow.getJobId() + " was already used");
        }
        escrow.setAgent(agent);
        return surplus;
    }

    /**
     * Pays {@code amount} from the balance to the agent.
     */
    public void release(EscrowRecord escrow, BigDecimal amount, Instant now) {
        BigDecimal value = Amounts.requirePositive(amount, "Release amount");
        if (escrow.getAgent() == null) {
            throw new MarketplaceException(ErrorCode.NO_AGENT, "Escrow for job " + escrow.getJobId() + " has no agent");
        }
        requireDisbursable(escrow, value);
        escrow.setReleasedAmount(Amounts.normalize(escrow.getReleasedAmount().add(value)));
        updateStatusAfterDisbursement(escrow, now);
    }

    /**
     * Returns {@code amount} from the balance to the client.
     */
    public void refund(EscrowRecord escrow, BigDecimal amount, Instant now) {
        BigDecimal value = Amounts.requirePositive(amount, "Refund amount");
        requireDisbursable(escrow, value);
        escrow.setRefundedAmount(Amounts.normalize(escrow.getRefundedAmount().add(value)));
        updateStatusAfterDisbursement(escrow, now);
    }

    /**
     * Releases whatever is left. No-op on an empty or unfunded escrow.
     *
     * @return the amount released
     */
    public BigDecimal releaseRemaining(EscrowRecord escrow, Instant now) {
        BigDecimal balance = escrow.getBalance();
        if (!escrow.getStatus().isActive() || balance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        release(escrow, balance, now);
        return balance;
    }

    /**
     * Refunds whatever is left. No-op on an empty or unfunded escrow.
     *
     * @return the amount refunded
     */
    public BigDecimal refundRemaining(EscrowRecord escrow, Instant now) {
        BigDecimal balance = escrow.getBalance();
        if (!escrow.getStatus().isActive() || balance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        refund(escrow, balance, now);
        return balance;
    }

    /**
     * Refunds {@code refundPercentage}% of the balance (rounded down) and releases the rest.
     *
     * @return {refunded, released}
     */
    public BigDecimal[] split(EscrowRecord escrow, int refundPercentage, Instant now) {
        BigDecimal balance = escrow.getStatus().isActive() ? escrow.getBalance() : BigDecimal.ZERO;
        BigDecimal refundPart = Amounts.percentOf(balance, refundPercentage);
        BigDecimal releasePart = Amounts.normalize(balance.subtract(refundPart));
        if (refundPart.signum() > 0) {
            refund(escrow, refundPart, now);
        }
        if (releasePart.signum() > 0) {
            release(escrow, releasePart, now);
        }
        return new BigDecimal[] {refundPart, releasePart};
    }

    private boolean isUntouchedLock(EscrowRecord escrow) {
        return escrow.getStatus() == EscrowStatus.LOCKED
                && escrow.getAgent() == null
                && escrow.getReleasedAmount().signum() == 0
                && escrow.getRefundedAmount().signum() == 0
                && Amounts.zeroIfNull(escrow.getSurplusRefunded()).signum() == 0;
    }

    private void requireDisbursable(EscrowRecord escrow, BigDecimal amount) {
        if (!escrow.getStatus().isActive()) {
            throw MarketplaceException.invalidState("Escrow for job " + escrow.getJobId() + " is " + escrow.getStatus());
        }
        if (amount.compareTo(escrow.getBalance()) > 0) {
            throw new MarketplaceException(ErrorCode.INSUFFICIENT_ESCROW, "Amount " + amount.toPlainString()
                    + " exceeds escrow balance " + escrow.getBalance().toPlainString());
        }
    }

    private void updateStatusAfterDisbursement(EscrowRecord escrow, Instant now) {
        if (escrow.getBalance().signum() > 0) {
            escrow.setStatus(EscrowStatus.PARTIALLY_RELEASED);
            return;
        }
        escrow.setStatus(escrow.getReleasedAmount().signum() == 0 ? EscrowStatus.REFUNDED : EscrowStatus.RELEASED);
        escrow.setReleasedAt(now);
    }
}
