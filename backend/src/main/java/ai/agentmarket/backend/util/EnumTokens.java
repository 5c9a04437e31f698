package ai.agentmarket.backend.util;

import ai.agentmarket.backend.service.exception.MarketplaceException;

import java.util.Locale;

/**
 * Parses enum tokens such as {@code IN_PROGRESS}, {@code in-progress} or {@code "In Progress"}.
 * Case, underscores, hyphens and whitespace are ignored. Unknown tokens are rejected.
 */
public final class EnumTokens {

    private EnumTokens() {
    }

    public static <E extends Enum<E>> E parse(Class<E> type, String token) {
        if (token == null || token.isBlank()) {
            throw MarketplaceException.invalidArgument("Missing " + type.getSimpleName() + " value");
        }
        String normalized = normalize(token);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(normalized)) {
                return constant;
            }
        }
        throw MarketplaceException.invalidArgument(
                "Unknown " + type.getSimpleName() + " value: " + SecurityUtils.sanitizeForLogging(token));
    }

    /**
     * Same as {@link #parse(Class, String)} but returns {@code null} for a null or blank token.
     */
    public static <E extends Enum<E>> E parseOptional(Class<E> type, String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return parse(type, token);
    }

    static String normalize(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c == '_' || c == '-' || Character.isWhitespace(c)) {
                continue;
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }
}
