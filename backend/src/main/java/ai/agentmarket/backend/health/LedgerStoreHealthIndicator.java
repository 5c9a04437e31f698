package ai.agentmarket.backend.health;

import ai.agentmarket.backend.store.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Health of the ledger store: whether its records can be counted and how long that takes.
 */
@Component
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private static final Logger logger = LoggerFactory.getLogger(LedgerStoreHealthIndicator.class);

    // Performance thresholds (milliseconds)
    private static final long GOOD_RESPONSE_TIME_MS = 100;
    private static final long WARNING_RESPONSE_TIME_MS = 500;

    private final LedgerStore ledgerStore;

    @Autowired
    public LedgerStoreHealthIndicator(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public Health health() {
        Health.Builder healthBuilder = new Health.Builder();

        try {
            Instant startTime = Instant.now();
            long records = ledgerStore.count();
            long responseTimeMs = Duration.between(startTime, Instant.now()).toMillis();

            if (responseTimeMs <= GOOD_RESPONSE_TIME_MS) {
                healthBuilder.up();
            } else if (responseTimeMs <= WARNING_RESPONSE_TIME_MS) {
                healthBuilder.status("WARNING");
            } else {
                healthBuilder.status("SLOW");
            }

            healthBuilder
                    .withDetail("store", ledgerStore.storeType())
                    .withDetail("records", records)
                    .withDetail("response_time_ms", responseTimeMs);
        } catch (Exception e) {
            logger.error("Ledger store health check failed: {}", e.getMessage());
            healthBuilder.down()
                    .withDetail("store", ledgerStore.storeType())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("message", String.valueOf(e.getMessage()));
        }

        return healthBuilder.build();
    }
}
