package ai.agentmarket.backend.service;

import ai.agentmarket.backend.event.MarketplaceEvent;
import ai.agentmarket.backend.event.MarketplaceEventType;
import ai.agentmarket.backend.model.dto.RateAgentRequest;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Rating;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.service.exception.ErrorCode;
import ai.agentmarket.backend.service.exception.MarketplaceException;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.SequenceGenerator;
import ai.agentmarket.backend.util.Inputs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Ratings exchanged by the two parties of a completed job.
 */
@Slf4j
@Service
public class ReputationService {

    static final String RATING_SEQUENCE = "rating";

    private final LedgerStore ledgerStore;
    private final LedgerCommitter committer;
    private final SequenceGenerator sequenceGenerator;
    private final Clock clock;

    public ReputationService(LedgerStore ledgerStore, LedgerCommitter committer, SequenceGenerator sequenceGenerator, Clock clock) {
        this.ledgerStore = ledgerStore;
        this.committer = committer;
        this.sequenceGenerator = sequenceGenerator;
        this.clock = clock;
    }

    /**
     * Rates the other party of a completed job. The counterpart's profile aggregates are updated
     * when it is a registered agent; the rating itself is always kept.
     *
     * @return the rating id
     */
    public long rateAgent(CallerIdentity caller, long jobId, RateAgentRequest request) {
        Integer score = request.getRating();
        if (score == null || score < 1 || score > 5) {
            throw MarketplaceException.invalidArgument("Rating must be between 1 and 5");
        }
        Job job = JobLedgerServiceImpl.requireJob(ledgerStore, jobId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw MarketplaceException.invalidState("Job " + jobId + " is not completed");
        }
        String ratee;
        if (job.isClient(caller.getId())) {
            ratee = job.getAgent();
        } else if (job.isAssignedAgent(caller.getId())) {
            ratee = job.getClient();
        } else {
            throw MarketplaceException.invalidState("Only the client or agent of job " + jobId + " can rate it");
        }
        if (ledgerStore.rating(jobId, caller.getId()).isPresent()) {
            throw new MarketplaceException(ErrorCode.DUPLICATE_RATING, caller.getId() + " already rated job " + jobId);
        }

        Instant now = clock.instant();
        long ratingId = sequenceGenerator.next(RATING_SEQUENCE);
        Rating rating = Rating.builder()
                .id(ratingId)
                .jobId(jobId)
                .rater(caller.getId())
                .ratee(ratee)
                .rating(score)
                .review(Inputs.optionalText(request.getReview()))
                .timestamp(now)
                .build();

        LedgerTransaction transaction = new LedgerTransaction()
                .guard(job)
                .save(rating)
                .publish(MarketplaceEvent.of(MarketplaceEventType.AGENT_RATED, jobId, caller.getId(), ratee, null, now));
        ledgerStore.agent(ratee).ifPresent(profile -> {
            profile.setTotalRatingPoints(profile.getTotalRatingPoints() + score);
            profile.setTotalRatings(profile.getTotalRatings() + 1);
            transaction.save(profile);
        });
        committer.commit("rate_agent", transaction);

        log.info("{} rated {} with {} for job {}", caller.getId(), ratee, score, jobId);
        return ratingId;
    }
}
