package ai.agentmarket.backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Refuses to run the marketplace with settings that would let anyone forge tokens or lose the ledger
 * silently. Runs once the context is ready.
 */
@Component
public class SecurityValidation {

    private static final Logger logger = LoggerFactory.getLogger(SecurityValidation.class);

    static final String INSECURE_FALLBACK_SECRET = "LOCAL_ONLY_MARKETPLACE_SIGNING_KEY_9f3Kq7Zx2Lm8Rv4Tn6Wb1Yc5";

    // HS256 keys shorter than 256 bits are rejected by Nimbus anyway
    private static final int MIN_SECRET_LENGTH = 32;

    private static final int MIN_DISTINCT_CHARACTERS = 10;

    private final String jwtSecret;
    private final String adminRole;
    private final String[] adminSubjects;
    private final MarketplaceProperties properties;
    private final Environment environment;

    public SecurityValidation(
            @Value("${marketplace.security.jwt-secret:}") String jwtSecret,
            @Value("${marketplace.security.admin-role:DISPUTE_ADMIN}") String adminRole,
            @Value("${marketplace.security.admin-subjects:}") String[] adminSubjects,
            MarketplaceProperties properties,
            Environment environment) {
        this.jwtSecret = jwtSecret;
        this.adminRole = adminRole;
        this.adminSubjects = adminSubjects;
        this.properties = properties;
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateSecurityConfiguration() {
        logger.info("Validating marketplace security settings...");

        validateJwtSecret();
        validateAdminSettings();
        validateLedgerStore();

        logger.info("Marketplace security settings validated");
    }

    void validateJwtSecret() {
        if (jwtSecret == null || jwtSecret.isBlank()) {
            logger.error("CRITICAL SECURITY ISSUE: marketplace JWT secret is not configured");
            throw new IllegalStateException("Set MARKETPLACE_JWT_SECRET before starting the marketplace");
        }

        if (INSECURE_FALLBACK_SECRET.equals(jwtSecret)) {
            if (isProductionEnvironment()) {
                logger.error("CRITICAL SECURITY ISSUE: local signing key used with a production profile");
                throw new IllegalStateException("Production deployment requires its own MARKETPLACE_JWT_SECRET");
            }
            logger.warn("Using the local signing key. Tokens signed with it are not trustworthy outside development.");
        }

        if (jwtSecret.length() < MIN_SECRET_LENGTH) {
            logger.error("CRITICAL SECURITY ISSUE: JWT secret has {} characters, {} required",
                    jwtSecret.length(), MIN_SECRET_LENGTH);
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_LENGTH + " characters long");
        }

        long distinct = jwtSecret.chars().distinct().count();
        if (distinct < MIN_DISTINCT_CHARACTERS) {
            logger.error("CRITICAL SECURITY ISSUE: JWT secret uses only {} distinct characters", distinct);
            throw new IllegalStateException("JWT secret must be cryptographically strong");
        }

        logger.info("JWT secret accepted (length: {} characters)", jwtSecret.length());
    }

    void validateAdminSettings() {
        if (adminRole == null || adminRole.isBlank()) {
            throw new IllegalStateException("marketplace.security.admin-role must not be blank");
        }
        if (adminRole.startsWith("ROLE_")) {
            logger.warn("Admin role '{}' already carries the ROLE_ prefix; tokens must then contain '{}' in their roles claim",
                    adminRole, adminRole);
        }
        long subjects = adminSubjects == null ? 0 : Arrays.stream(adminSubjects).filter(s -> !s.isBlank()).count();
        if (subjects > 0) {
            logger.info("{} admin subject(s) configured in addition to role {}", subjects, adminRole);
        } else if (isProductionEnvironment()) {
            logger.warn("No admin subjects configured; disputes can only be resolved by tokens with role {}", adminRole);
        }
    }

    void validateLedgerStore() {
        MarketplaceProperties.Store store = properties.getStore();
        if ("redis".equalsIgnoreCase(store.getType())) {
            if (store.getKeyPrefix() == null || store.getKeyPrefix().isBlank()) {
                throw new IllegalStateException("marketplace.store.key-prefix must not be blank for the Redis ledger store");
            }
        } else if (isProductionEnvironment()) {
            logger.warn("Production profile active with the in-memory ledger store. Ledger state is lost on restart.");
        }

        MarketplaceProperties.Query query = properties.getQuery();
        if (query.getDefaultLimit() > query.getMaxLimit()) {
            logger.warn("marketplace.query.default-limit ({}) exceeds max-limit ({}); pages are capped at {}",
                    query.getDefaultLimit(), query.getMaxLimit(), query.getMaxLimit());
        }
    }

    private boolean isProductionEnvironment() {
        return Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> "prod".equals(profile) || "production".equals(profile));
    }
}
