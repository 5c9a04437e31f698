package ai.agentmarket.backend.service;

import ai.agentmarket.backend.service.exception.MarketplaceException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Micrometer metrics for marketplace mutations and escrow money flow.
 *
 * Key Features:
 * - Mutation latency per operation
 * - Mutation outcome counters (success or the rejecting error code)
 * - Disbursed escrow volume by kind (release, refund)
 */
@Slf4j
@Service
public class MarketplaceMetricsService {

    static final String MUTATION_TIMER = "marketplace_mutation_duration_seconds";
    static final String MUTATION_COUNTER = "marketplace_mutations_total";
    static final String DISBURSEMENT_SUMMARY = "marketplace_escrow_disbursed";
    static final String EVENT_COUNTER = "marketplace_events_total";

    private final MeterRegistry meterRegistry;

    // Cache for Timer instances to avoid repeated creation
    private final ConcurrentMap<String, Timer> timerCache = new ConcurrentHashMap<>();

    @Autowired
    public MarketplaceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("MarketplaceMetricsService initialized with MeterRegistry");
    }

    /**
     * Times a mutation and counts its outcome. Exceptions are recorded and rethrown unchanged.
     *
     * @param operation the mutation name, e.g. "place_bid"
     * @param mutation the mutation to run
     * @return the mutation's result
     */
    public <T> T recordMutation(String operation, Supplier<T> mutation) {
        Timer timer = timerCache.computeIfAbsent(operation, op -> Timer.builder(MUTATION_TIMER)
                .description("Duration of marketplace mutations")
                .tag("operation", op)
                .register(meterRegistry));

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = mutation.get();
            incrementOutcome(operation, "success");
            return result;
        } catch (MarketplaceException e) {
            incrementOutcome(operation, e.getErrorCode().name().toLowerCase(Locale.ROOT));
            throw e;
        } catch (RuntimeException e) {
            incrementOutcome(operation, "error");
            throw e;
        } finally {
            sample.stop(timer);
        }
    }

    /**
     * Records money leaving escrow.
     *
     * @param kind "release" or "refund"
     * @param amount the disbursed amount
     */
    public void recordDisbursement(String kind, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        DistributionSummary.builder(DISBURSEMENT_SUMMARY)
                .description("Amounts released or refunded from escrow")
                .tag("kind", kind)
                .register(meterRegistry)
                .record(amount.doubleValue());
    }

    public void incrementEventCounter(String eventType) {
        Counter.builder(EVENT_COUNTER)
                .description("Domain events handled after commit")
                .tag("type", eventType)
                .register(meterRegistry)
                .increment();
    }

    private void incrementOutcome(String operation, String outcome) {
        Counter.builder(MUTATION_COUNTER)
                .description("Marketplace mutations by outcome")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
