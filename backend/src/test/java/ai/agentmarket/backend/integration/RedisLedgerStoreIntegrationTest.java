package ai.agentmarket.backend.integration;

import ai.agentmarket.backend.config.RedisConfig;
import ai.agentmarket.backend.model.entity.Bid;
import ai.agentmarket.backend.model.entity.Job;
import ai.agentmarket.backend.model.entity.JobStatus;
import ai.agentmarket.backend.store.LedgerTransaction;
import ai.agentmarket.backend.store.RecordType;
import ai.agentmarket.backend.store.RedisLedgerStore;
import ai.agentmarket.backend.store.RedisSequenceGenerator;
import ai.agentmarket.backend.store.StaleRecordException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for the Redis ledger store.
 * These tests require a running Redis instance.
 * Run with: -Dredis.integration.test=true
 */
@SpringBootTest(classes = RedisConfig.class)
@TestPropertySource(properties = {
    "marketplace.store.type=redis",
    "spring.data.redis.host=localhost",
    "spring.data.redis.port=6379",
    "spring.data.redis.database=15" // Use test database
})
@EnabledIfSystemProperty(named = "redis.integration.test", matches = "true")
class RedisLedgerStoreIntegrationTest {

    @Autowired
    @Qualifier("ledgerRedisTemplate")
    private RedisTemplate<String, String> redisTemplate;

    private String keyPrefix;
    private RedisLedgerStore store;

    @BeforeEach
    void setUp() {
        keyPrefix = "agentmarket-it:" + System.currentTimeMillis() + ":";
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        store = new RedisLedgerStore(redisTemplate, objectMapper, keyPrefix);
    }

    @AfterEach
    void cleanup() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        if (keys != null && !keys.isEmpty()) {
            redisTemplate.delete(keys);
        }
    }

    @Test
    void committedRecordsRoundTripThroughSnapshot() {
        // Given
        store.commit(new LedgerTransaction().save(job(1)).save(bid(1, "agent-1")));

        // When
        Job stored = store.snapshot().job(1).orElseThrow();

        // Then
        assertThat(stored.getVersion()).isEqualTo(1);
        assertThat(stored.getPayment()).isEqualByComparingTo("90.5");
        assertThat(stored.getCreatedAt()).isEqualTo(Instant.parse("2025-03-01T10:00:00Z"));
        assertThat(store.snapshot().bids(1)).extracting(Bid::getAgent).containsExactly("agent-1");
    }

    @Test
    void staleWriteIsRejectedWithoutPartialEffects() {
        // Given
        store.commit(new LedgerTransaction().save(job(1)));
        Job first = store.snapshot().job(1).orElseThrow();
        Job second = store.snapshot().job(1).orElseThrow();
        store.commit(new LedgerTransaction().save(first));

        // When
        second.setStatus(JobStatus.CANCELLED);
        LedgerTransaction stale = new LedgerTransaction().save(job(2)).save(second);

        // Then
        assertThatThrownBy(() -> store.commit(stale)).isInstanceOf(StaleRecordException.class);
        assertThat(store.snapshot().job(2)).isEmpty();
        assertThat(store.snapshot().job(1).orElseThrow().getStatus()).isEqualTo(JobStatus.POSTED);
    }

    @Test
    void duplicateBidIsCreateConflict() {
        store.commit(new LedgerTransaction().save(bid(1, "agent-1")));

        assertThatThrownBy(() -> store.commit(new LedgerTransaction().save(bid(1, "agent-1"))))
                .isInstanceOf(StaleRecordException.class)
                .satisfies(e -> assertThat(((StaleRecordException) e).getRecordType()).isEqualTo(RecordType.BID));
    }

    @Test
    void keyedReadsUseTheJobIndexSets() {
        // Given
        store.commit(new LedgerTransaction().save(job(1)).save(job(2)).save(bid(1, "agent-1")));
        store.commit(new LedgerTransaction().save(bid(2, "agent-2")));

        // When / Then
        assertThat(store.job(1)).map(Job::getTitle).contains("job 1");
        assertThat(store.job(3)).isEmpty();
        assertThat(store.bids(1)).extracting(Bid::getAgent).containsExactly("agent-1");
        assertThat(store.bids(2)).extracting(Bid::getAgent).containsExactly("agent-2");
        assertThat(store.findAll(RecordType.JOB, Job.class)).hasSize(2);
        assertThat(store.count()).isEqualTo(4);
        assertThat(redisTemplate.opsForSet().members(keyPrefix + "index:job:1:bid"))
                .containsExactly(keyPrefix + "bid:1:agent-1");
    }

    @Test
    void emptyLedgerSnapshotIsEmpty() {
        assertThat(store.snapshot().size()).isZero();
    }

    @Test
    void sequencesIncrementPerName() {
        RedisSequenceGenerator sequences = new RedisSequenceGenerator(redisTemplate, keyPrefix);

        assertThat(sequences.next("job")).isEqualTo(1);
        assertThat(sequences.next("job")).isEqualTo(2);
        assertThat(sequences.next("dispute")).isEqualTo(1);
    }

    private static Job job(long id) {
        return Job.builder()
                .id(id)
                .client("client-1")
                .title("job " + id)
                .description("d")
                .payment(new BigDecimal("90.5"))
                .status(JobStatus.POSTED)
                .escrowId(id)
                .createdAt(Instant.parse("2025-03-01T10:00:00Z"))
                .build();
    }

    private static Bid bid(long jobId, String agent) {
        return Bid.builder().jobId(jobId).bidId(1).agent(agent).amount(BigDecimal.ONE).proposal("p").estimatedDays(1).build();
    }
}
