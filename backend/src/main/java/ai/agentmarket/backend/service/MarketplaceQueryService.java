package ai.agentmarket.backend.service;

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
import ai.agentmarket.backend.model.entity.JobCategory;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.model.entity.Rating;
import ai.agentmarket.backend.model.entity.VerificationLevel;
import ai.agentmarket.backend.security.CallerIdentity;

import java.util.List;
import java.util.Optional;

/**
 * Read-only views of the ledger. Point lookups read by key, lists and aggregates read a snapshot. Never writes.
 */
public interface MarketplaceQueryService {

    /**
     * Filtered, sorted and paged jobs.
     *
     * @param filter criteria, null for none
     * @param sortBy sort field, CREATED_AT when null
     * @param direction sort direction, ASC when null
     * @param limit page size, configured default when null
     * @param offset items to skip, 0 when null
     */
    List<JobView> jobs(JobFilter filter, JobSortField sortBy, SortDirection direction, Integer limit, Integer offset);

    Optional<JobView> job(long jobId);

    /**
     * Case-insensitive substring match over title, description and tags. A blank query matches nothing.
     */
    List<JobView> searchJobs(String query);

    List<JobView> jobsByCategory(JobCategory category);

    long jobsCount(JobStatus status);

    List<AgentProfile> agents(AgentFilter filter, AgentSortField sortBy, SortDirection direction, Integer limit, Integer offset);

    Optional<AgentProfile> agent(String owner);

    List<AgentProfile> agentsBySkill(String skill);

    /**
     * Agents at or above the given level, VERIFIED when null.
     */
    List<AgentProfile> verifiedAgents(VerificationLevel minLevel);

    List<Rating> agentRatings(String owner);

    MarketplaceStats stats();

    List<Dispute> disputes(DisputeFilter filter);

    Optional<Dispute> dispute(long disputeId);

    Optional<EscrowRecord> escrow(long jobId);

    List<EscrowRecord> activeEscrows();

    /**
     * Messages of a job, ordered by timestamp then id. Participants only.
     */
    List<ChatMessage> jobMessages(CallerIdentity caller, long jobId);

    long unreadMessagesCount(CallerIdentity caller);
}
