package ai.agentmarket.backend.util;

import ai.agentmarket.backend.service.exception.MarketplaceException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalisation of free-text request fields.
 */
public final class Inputs {

    private Inputs() {
    }

    /**
     * Trimmed value, or INVALID_ARGUMENT when missing or blank.
     */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw MarketplaceException.invalidArgument(field + " must not be blank");
        }
        return value.trim();
    }

    public static String requireText(String value, String field, int maxLength) {
        String text = requireText(value, field);
        if (text.length() > maxLength) {
            throw MarketplaceException.invalidArgument(field + " must be at most " + maxLength + " characters");
        }
        return text;
    }

    /**
     * Trimmed value, or null when missing or blank.
     */
    public static String optionalText(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Trims entries, drops blanks and removes case-insensitive duplicates, keeping first occurrences.
     */
    public static List<String> distinctTokens(List<String> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                String trimmed = value.trim();
                unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        return new ArrayList<>(unique.values());
    }
}
