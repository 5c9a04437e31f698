package ai.agentmarket.backend.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Security utilities for input sanitization and validation.
 * Keeps user-supplied text (titles, reasons, URLs) from injecting control characters into logs
 * and rejects portfolio links that are not plain web URLs.
 */
public class SecurityUtils {

    // Pattern to match potentially dangerous characters for logging
    private static final Pattern DANGEROUS_LOG_CHARS = Pattern.compile("[\\r\\n\\t\\x00-\\x1F\\x7F-\\x9F]");

    // Pattern to match control characters and non-printable characters
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}]");

    private static final int MAX_LOG_LENGTH = 500;

    private static final int MAX_URL_LENGTH = 2048;

    /**
     * Sanitizes a general string for safe logging.
     * Removes control characters and newlines that could be used for log injection.
     *
     * @param input the string to sanitize
     * @return sanitized string safe for logging
     */
    public static String sanitizeForLogging(String input) {
        if (input == null) {
            return "null";
        }

        if (input.isEmpty()) {
            return "empty";
        }

        String sanitized = DANGEROUS_LOG_CHARS.matcher(input).replaceAll("_");
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("_");

        if (sanitized.length() > MAX_LOG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_LOG_LENGTH - 3) + "...";
        }

        return sanitized;
    }

    /**
     * Validates a portfolio link: absolute http(s) URL with a host and no control characters.
     *
     * @param url the URL to validate
     * @return true if the URL is safe to store and render, false otherwise
     */
    public static boolean isSafeUrl(String url) {
        if (url == null || url.isBlank() || url.length() > MAX_URL_LENGTH) {
            return false;
        }

        if (CONTROL_CHARS.matcher(url).find()) {
            return false;
        }

        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null) {
                return false;
            }
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            return ("http".equals(lowerScheme) || "https".equals(lowerScheme)) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
