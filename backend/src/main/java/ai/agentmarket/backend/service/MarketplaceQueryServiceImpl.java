package ai.agentmarket.backend.service;

import ai.agentmarket.backend.config.MarketplaceProperties;
import ai.agentmarket.backend.model.dto.AgentFilter;
import ai.agentmarket.backend.model.dto.AgentSortField;
import ai.agentmarket.backend.model.dto.DisputeFilter;
import ai.agentmarket.backend.model.dto.JobFilter;
import ai.agentmarket.backend.model.dto.JobSortField;
import ai.agentmarket.backend.model.dto.JobView;
import ai.agentmarket.backend.model.dto.MarketplaceStats;
import ai.agentmarket.backend.model.dto.SortDirection;
import ai.agentmarket.backend.model.entity.AgentProfile;
import ai.agentmarket.backend.model.entity.ChatMessage;
import ai.agentmarket.backend.model.entity.Dispute;
import ai.agentmarket.backend.model.entity.EscrowRecord;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Rating;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerSnapshot;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.util.Amounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class MarketplaceQueryServiceImpl implements MarketplaceQueryService {

    private final LedgerStore ledgerStore;
    private final MarketplaceProperties properties;

    public MarketplaceQueryServiceImpl(LedgerStore ledgerStore, MarketplaceProperties properties) {
        this.ledgerStore = ledgerStore;
        this.properties = properties;
    }

    @Override
    public List<JobView> jobs(JobFilter filter, JobSortField sortBy, SortDirection direction, Integer limit, Integer offset) {
        LedgerSnapshot snapshot = ledgerStore.snapshot();
        Comparator<Job> order = jobOrder(sortBy == null ? JobSortField.CREATED_AT : sortBy);
        if (direction == SortDirection.DESC) {
            order = order.reversed();
        }
        List<JobView> result = page(snapshot.jobs().stream().filter(jobPredicate(filter)).sorted(order), limit, offset)
                .map(job -> JobView.of(job, snapshot.bids(job.getId())))
                .collect(Collectors.toList());
        log.debug("jobs query returned {} result(s)", result.size());
        return result;
    }

    @Override
    public Optional<JobView> job(long jobId) {
        return ledgerStore.job(jobId).map(job -> JobView.of(job, ledgerStore.bids(jobId)));
    }

    @Override
    public List<JobView> searchJobs(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        LedgerSnapshot snapshot = ledgerStore.snapshot();
        return snapshot.jobs().stream()
                .filter(job -> contains(job.getTitle(), needle)
                        || contains(job.getDescription(), needle)
                        || job.getTags().stream().anyMatch(tag -> contains(tag, needle)))
                .map(job -> JobView.of(job, snapshot.bids(job.getId())))
                .collect(Collectors.toList());
    }

    @Override
    public List<JobView> jobsByCategory(JobCategory category) {
        return jobs(JobFilter.builder().category(category).build(), JobSortField.ID, SortDirection.ASC,
                properties.getQuery().getMaxLimit(), 0);
    }

    @Override
    public long jobsCount(JobStatus status) {
        return ledgerStore.snapshot().jobs().stream()
                .filter(job -> status == null || job.getStatus() == status)
                .count();
    }

    @Override
    public List<AgentProfile> agents(AgentFilter filter, AgentSortField sortBy, SortDirection direction, Integer limit, Integer offset) {
        Comparator<AgentProfile> order = agentOrder(sortBy == null ? AgentSortField.JOBS_COMPLETED : sortBy);
        if (direction == SortDirection.DESC) {
            order = order.reversed();
        }
        return page(ledgerStore.snapshot().agents().stream().filter(agentPredicate(filter)).sorted(order), limit, offset)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<AgentProfile> agent(String owner) {
        return ledgerStore.agent(owner);
    }

    @Override
    public List<AgentProfile> agentsBySkill(String skill) {
        if (skill == null || skill.isBlank()) {
            return List.of();
        }
        String wanted = skill.trim();
        return ledgerStore.snapshot().agents().stream()
                .filter(agent -> agent.hasSkill(wanted))
                .collect(Collectors.toList());
    }

    @Override
    public List<AgentProfile> verifiedAgents(VerificationLevel minLevel) {
        VerificationLevel threshold = minLevel == null ? VerificationLevel.VERIFIED : minLevel;
        return ledgerStore.snapshot().agents().stream()
                .filter(agent -> agent.getVerificationLevel().isAtLeast(threshold))
                .collect(Collectors.toList());
    }

    @Override
    public List<Rating> agentRatings(String owner) {
        return ledgerStore.snapshot().ratings().stream()
                .filter(rating -> owner.equals(rating.getRatee()))
                .collect(Collectors.toList());
    }

    @Override
    public MarketplaceStats stats() {
        LedgerSnapshot snapshot = ledgerStore.snapshot();
        List<Job> jobs = snapshot.jobs();
        BigDecimal paymentVolume = jobs.stream().map(Job::getPayment).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal escrowLocked = snapshot.escrows().stream()
                .filter(escrow -> escrow.getStatus().isActive())
                .map(EscrowRecord::getBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return MarketplaceStats.builder()
                .totalJobs(jobs.size())
                .postedJobs(countStatus(jobs, JobStatus.POSTED))
                .inProgressJobs(countStatus(jobs, JobStatus.IN_PROGRESS))
                .completedJobs(countStatus(jobs, JobStatus.COMPLETED))
                .cancelledJobs(countStatus(jobs, JobStatus.CANCELLED))
                .disputedJobs(countStatus(jobs, JobStatus.DISPUTED))
                .totalAgents(snapshot.agents().size())
                .totalPaymentVolume(Amounts.normalize(paymentVolume))
                .totalEscrowLocked(Amounts.normalize(escrowLocked))
                .openDisputes(snapshot.disputes().stream().filter(d -> !d.getStatus().isResolved()).count())
                .build();
    }

    @Override
    public List<Dispute> disputes(DisputeFilter filter) {
        Predicate<Dispute> predicate = dispute -> true;
        if (filter != null) {
            if (filter.getStatus() != null) {
                predicate = predicate.and(d -> d.getStatus() == filter.getStatus());
            }
            if (filter.getJobId() != null) {
                predicate = predicate.and(d -> d.getJobId() == filter.getJobId());
            }
            if (filter.getParty() != null) {
                predicate = predicate.and(d -> d.involves(filter.getParty()));
            }
        }
        List<Dispute> candidates = filter != null && filter.getJobId() != null
                ? ledgerStore.disputes(filter.getJobId())
                : ledgerStore.snapshot().disputes();
        return candidates.stream().filter(predicate).collect(Collectors.toList());
    }

    @Override
    public Optional<Dispute> dispute(long disputeId) {
        return ledgerStore.dispute(disputeId);
    }

    @Override
    public Optional<EscrowRecord> escrow(long jobId) {
        return ledgerStore.escrow(jobId);
    }

    @Override
    public List<EscrowRecord> activeEscrows() {
        return ledgerStore.snapshot().escrows().stream()
                .filter(escrow -> escrow.getStatus().isActive())
                .collect(Collectors.toList());
    }

    @Override
    public List<ChatMessage> jobMessages(CallerIdentity caller, long jobId) {
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (!MessagingService.isParticipant(ledgerStore, job, caller.getId())) {
            throw MarketplaceException.unauthorized("Only participants of job " + jobId + " can read its messages");
        }
        return ledgerStore.messages(jobId);
    }

    @Override
    public long unreadMessagesCount(CallerIdentity caller) {
        return ledgerStore.snapshot().messages().stream()
                .filter(message -> caller.is(message.getRecipient()) && !message.isRead())
                .count();
    }

    private <T> Stream<T> page(Stream<T> items, Integer limit, Integer offset) {
        int skip = offset == null ? 0 : Math.max(0, offset);
        return items.skip(skip).limit(properties.getQuery().resolveLimit(limit));
    }

    private static Predicate<Job> jobPredicate(JobFilter filter) {
        Predicate<Job> predicate = job -> true;
        if (filter == null) {
            return predicate;
        }
        if (filter.getStatus() != null) {
            predicate = predicate.and(job -> job.getStatus() == filter.getStatus());
        }
        if (filter.getMinPayment() != null) {
            predicate = predicate.and(job -> job.getPayment().compareTo(filter.getMinPayment()) >= 0);
        }
        if (filter.getMaxPayment() != null) {
            predicate = predicate.and(job -> job.getPayment().compareTo(filter.getMaxPayment()) <= 0);
        }
        if (filter.getClient() != null) {
            predicate = predicate.and(job -> job.isClient(filter.getClient()));
        }
        if (filter.getAgent() != null) {
            predicate = predicate.and(job -> job.isAssignedAgent(filter.getAgent()));
        }
        if (filter.getCategory() != null) {
            predicate = predicate.and(job -> job.getCategory() == filter.getCategory());
        }
        if (filter.getTag() != null) {
            predicate = predicate.and(job -> job.getTags().stream().anyMatch(tag -> tag.equalsIgnoreCase(filter.getTag())));
        }
        return predicate;
    }

    private static Predicate<AgentProfile> agentPredicate(AgentFilter filter) {
        Predicate<AgentProfile> predicate = agent -> true;
        if (filter == null) {
            return predicate;
        }
        if (filter.getMinJobsCompleted() != null) {
            predicate = predicate.and(agent -> agent.getJobsCompleted() >= filter.getMinJobsCompleted());
        }
        if (filter.getMinRating() != null) {
            predicate = predicate.and(agent -> agent.getTotalRatings() > 0 ? agent.getRating() >= filter.getMinRating()
                    : filter.getMinRating() <= 0);
        }
        if (filter.getSkill() != null) {
            predicate = predicate.and(agent -> agent.hasSkill(filter.getSkill()));
        }
        if (filter.getAvailable() != null) {
            predicate = predicate.and(agent -> agent.isAvailability() == filter.getAvailable());
        }
        if (filter.getMinVerificationLevel() != null) {
            predicate = predicate.and(agent -> agent.getVerificationLevel().isAtLeast(filter.getMinVerificationLevel()));
        }
        return predicate;
    }

    private static Comparator<Job> jobOrder(JobSortField sortBy) {
        Comparator<Job> byId = Comparator.comparingLong(Job::getId);
        switch (sortBy) {
            case PAYMENT:
                return Comparator.comparing(Job::getPayment).thenComparing(byId);
            case ID:
                return byId;
            case DEADLINE:
                // jobs without a deadline sort last
                return Comparator.comparing(Job::getDeadline, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                        .thenComparing(byId);
            case CREATED_AT:
            default:
                return Comparator.comparing(Job::getCreatedAt).thenComparing(byId);
        }
    }

    private static Comparator<AgentProfile> agentOrder(AgentSortField sortBy) {
        Comparator<AgentProfile> byOwner = Comparator.comparing(AgentProfile::getOwner);
        switch (sortBy) {
            case RATING:
                return Comparator.comparingDouble(AgentProfile::getRating).thenComparing(byOwner);
            case REGISTERED_AT:
                return Comparator.comparing(AgentProfile::getRegisteredAt).thenComparing(byOwner);
            case HOURLY_RATE:
                return Comparator.comparing(AgentProfile::getHourlyRate, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder()))
                        .thenComparing(byOwner);
            case JOBS_COMPLETED:
            default:
                return Comparator.comparingLong(AgentProfile::getJobsCompleted).thenComparing(byOwner);
        }
    }

    private static long countStatus(List<Job> jobs, JobStatus status) {
        return jobs.stream().filter(job -> job.getStatus() == status).count();
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
