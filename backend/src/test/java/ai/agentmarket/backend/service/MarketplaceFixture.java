package ai.agentmarket.backend.service;

import ai.agentmarket.backend.config.MarketplaceProperties;
import ai.agentmarket.backend.model.dto.AcceptBidRequest;
import ai.agentmarket.backend.model.dto.MilestoneRequest;
import ai.agentmarket.backend.model.dto.PlaceBidRequest;
import ai.agentmarket.backend.model.dto.PostJobRequest;
import ai.agentmarket.backend.model.dto.RegisterAgentRequest;
import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.security.CallerIdentity;
import ai.agentmarket.backend.store.InMemoryLedgerStore;
import ai.agentmarket.backend.store.InMemorySequenceGenerator;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.Mockito.mock;

/**
 * Wires every ledger service over a fresh in-memory store with a fixed clock.
 */
class MarketplaceFixture {

    static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    static final CallerIdentity CLIENT = CallerIdentity.user("client-1");
    static final CallerIdentity AGENT = CallerIdentity.user("agent-1");
    static final CallerIdentity OTHER_AGENT = CallerIdentity.user("agent-2");
    static final CallerIdentity STRANGER = CallerIdentity.user("stranger");
    static final CallerIdentity ADMIN = CallerIdentity.admin("admin-1");

    final InMemoryLedgerStore store;
    final ApplicationEventPublisher eventPublisher = mock(ApplicationEventPublisher.class);
    final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    final InMemorySequenceGenerator sequences = new InMemorySequenceGenerator();
    final EscrowManager escrowManager = new EscrowManager();
    final LedgerCommitter committer;

    final JobLedgerServiceImpl jobs;
    final EscrowService escrows;
    final MilestoneService milestones;
    final DisputeService disputes;
    final AgentRegistryService agents;
    final ReputationService reputation;
    final MessagingService messaging;
    final MarketplaceQueryServiceImpl queries;

    MarketplaceFixture() {
        this(new InMemoryLedgerStore());
    }

    MarketplaceFixture(InMemoryLedgerStore store) {
        this.store = store;
        committer = new LedgerCommitter(store, eventPublisher);
        jobs = new JobLedgerServiceImpl(store, committer, sequences, escrowManager, clock);
        escrows = new EscrowService(store, committer, escrowManager, clock);
        milestones = new MilestoneService(store, committer, escrowManager, clock);
        disputes = new DisputeService(store, committer, sequences, escrowManager, clock);
        agents = new AgentRegistryService(store, committer, clock);
        reputation = new ReputationService(store, committer, sequences, clock);
        messaging = new MessagingService(store, committer, sequences, clock);
        queries = new MarketplaceQueryServiceImpl(store, new MarketplaceProperties());
    }

    void register(CallerIdentity agent) {
        agents.registerAgent(agent, RegisterAgentRequest.builder()
                .name("Agent " + agent.getId())
                .skills(List.of("java", "spring"))
                .build());
    }

    long postJob(String payment) {
        return jobs.postJob(CLIENT, jobRequest(payment, null));
    }

    long postJobWithMilestones(String payment, int... percentages) {
        List<MilestoneRequest> milestoneRequests = new java.util.ArrayList<>();
        for (int i = 0; i < percentages.length; i++) {
            milestoneRequests.add(MilestoneRequest.builder()
                    .title("Milestone " + (i + 1))
                    .paymentPercentage(percentages[i])
                    .build());
        }
        return jobs.postJob(CLIENT, jobRequest(payment, milestoneRequests));
    }

    PostJobRequest jobRequest(String payment, List<MilestoneRequest> milestoneRequests) {
        return PostJobRequest.builder()
                .title("Build a scraper")
                .description("Scrape product listings into CSV")
                .payment(payment)
                .category(JobCategory.DEVELOPMENT)
                .tags(List.of("python", "scraping"))
                .milestones(milestoneRequests)
                .build();
    }

    long bid(CallerIdentity agent, long jobId, String amount) {
        return jobs.placeBid(agent, jobId, PlaceBidRequest.builder()
                .amount(amount)
                .proposal("I can do this")
                .estimatedDays(3)
                .build());
    }

    void accept(long jobId, CallerIdentity agent, String amount) {
        jobs.acceptBid(CLIENT, jobId, AcceptBidRequest.builder().agent(agent.getId()).bidAmount(amount).build());
    }

    /**
     * Posted, bid on by {@link #AGENT} and accepted at {@code bidAmount}.
     */
    long jobInProgress(String payment, String bidAmount) {
        register(AGENT);
        long jobId = postJob(payment);
        bid(AGENT, jobId, bidAmount);
        accept(jobId, AGENT, bidAmount);
        return jobId;
    }
}
