package ai.agentmarket.backend.service;

import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.RecordType;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Gauges for jobs by status, evaluated against the stored jobs on every scrape.
 */
@Component
public class LedgerGaugeBinder implements MeterBinder {

    private final LedgerStore ledgerStore;

    public LedgerGaugeBinder(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("marketplace_jobs", ledgerStore, store -> countJobs(store, status))
                    .description("Jobs in the ledger by status")
                    .tag("status", status.name())
                    .register(registry);
        }
    }

    private static double countJobs(LedgerStore store, JobStatus status) {
        return store.findAll(RecordType.JOB, Job.class).stream().filter(job -> job.getStatus() == status).count();
    }
}
