package ai.agentmarket.backend.util;

import ai.agentmarket.backend.service.exception.MarketplaceException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers. Amounts carry at most 18 fractional digits and are rounded down.
 */
public final class Amounts {

    public static final int SCALE = 18;

    /**
     * Digits allowed before the decimal point. Larger values are rejected before any rescaling,
     * so an exponent like {@code 1E+999999999} never expands into a plain number.
     */
    public static final int MAX_INTEGER_DIGITS = 30;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Amounts() {
    }

    /**
     * Parses a decimal string into a positive amount.
     *
     * @throws MarketplaceException INVALID_AMOUNT for malformed, non-positive, oversized or over-precise values
     */
    public static BigDecimal parsePositive(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw MarketplaceException.invalidAmount(field + " is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw MarketplaceException.invalidAmount(field + " is not a decimal amount: "
                    + SecurityUtils.sanitizeForLogging(raw));
        }
        return requirePositive(value, field);
    }

    /**
     * Like {@link #parsePositive(String, String)} but returns {@code null} when no value was given.
     */
    public static BigDecimal parseOptionalPositive(String raw, String field) {
        if (raw == null) {
            return null;
        }
        return parsePositive(raw, field);
    }

    /**
     * Parses an optional decimal filter value; zero is allowed, negatives are not.
     */
    public static BigDecimal parseOptionalFilter(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            if (value.signum() < 0) {
                throw MarketplaceException.invalidAmount(field + " must not be negative");
            }
            requireBounded(value, field);
            return normalize(value);
        } catch (NumberFormatException e) {
            throw MarketplaceException.invalidAmount(field + " is not a decimal amount: "
                    + SecurityUtils.sanitizeForLogging(raw));
        }
    }

    public static BigDecimal requirePositive(BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw MarketplaceException.invalidAmount(field + " must be greater than zero");
        }
        requireBounded(value, field);
        if (value.stripTrailingZeros().scale() > SCALE) {
            throw MarketplaceException.invalidAmount(field + " has more than " + SCALE + " decimal places");
        }
        return normalize(value);
    }

    private static void requireBounded(BigDecimal value, String field) {
        long integerDigits = (long) value.precision() - value.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw MarketplaceException.invalidAmount(field + " has more than " + MAX_INTEGER_DIGITS + " integer digits");
        }
    }

    /**
     * {@code percentage}% of {@code amount}, rounded down to 18 places.
     */
    public static BigDecimal percentOf(BigDecimal amount, int percentage) {
        BigDecimal share = amount.multiply(BigDecimal.valueOf(percentage))
                .divide(HUNDRED, SCALE, RoundingMode.DOWN);
        return normalize(share);
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    public static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
