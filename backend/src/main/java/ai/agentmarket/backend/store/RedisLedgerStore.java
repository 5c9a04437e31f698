package ai.agentmarket.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ledger store backed by Redis.
 *
 * Each record is a JSON string under {@code <prefix><type>:<id>}. Every type keeps a set of its keys
 * under {@code <prefix>index:<type>}, and records with a job scope are also listed in
 * {@code <prefix>index:job:<jobId>:<type>}. Commits use WATCH/MULTI/EXEC so the whole change set is
 * applied atomically and only if no watched key changed.
 *
 * Keyed and per-job reads are plain GET/SMEMBERS/MGET calls. Full snapshots are read by one Lua script
 * that walks every type index; Redis runs it atomically, so it blocks other clients for its duration
 * and is reserved for list and aggregate queries. The script returns a JSON array of alternating keys
 * and values.
 */
@Slf4j
public class RedisLedgerStore implements LedgerStore {

    private static final RedisScript<String> SNAPSHOT_SCRIPT = RedisScript.of(
            "local result = {}\n"
                    + "for _, index in ipairs(KEYS) do\n"
                    + "  for _, key in ipairs(redis.call('SMEMBERS', index)) do\n"
                    + "    local value = redis.call('GET', key)\n"
                    + "    if value then\n"
                    + "      table.insert(result, key)\n"
                    + "      table.insert(result, value)\n"
                    + "    end\n"
                    + "  end\n"
                    + "end\n"
                    + "if #result == 0 then return '[]' end\n"
                    + "return cjson.encode(result)",
            String.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisLedgerStore(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public LedgerSnapshot snapshot() {
        List<String> indexKeys = Arrays.stream(RecordType.values())
                .map(this::indexKey)
                .collect(Collectors.toList());

        String encoded = redisTemplate.execute(SNAPSHOT_SCRIPT, indexKeys);

        List<LedgerRecord> records = new ArrayList<>();
        if (encoded != null) {
            JsonNode values = readTree(encoded);
            for (int i = 0; i + 1 < values.size(); i += 2) {
                String ledgerKey = values.get(i).asText().substring(keyPrefix.length());
                records.add(deserialize(ledgerKey, values.get(i + 1).asText()));
            }
        }
        log.debug("Loaded snapshot with {} record(s) from Redis", records.size());
        return new LedgerSnapshot(records);
    }

    @Override
    public <T extends LedgerRecord> Optional<T> find(String key, Class<T> recordClass) {
        String json = redisTemplate.opsForValue().get(redisKey(key));
        return Optional.ofNullable(json).map(value -> recordClass.cast(deserialize(key, value)));
    }

    @Override
    public <T extends LedgerRecord> List<T> findByJob(long jobId, RecordType type, Class<T> recordClass) {
        return readMembers(jobIndexKey(jobId, type), recordClass);
    }

    @Override
    public <T extends LedgerRecord> List<T> findAll(RecordType type, Class<T> recordClass) {
        return readMembers(indexKey(type), recordClass);
    }

    @Override
    public long count() {
        long total = 0;
        for (RecordType type : RecordType.values()) {
            Long size = redisTemplate.opsForSet().size(indexKey(type));
            total += size == null ? 0 : size;
        }
        return total;
    }

    @Override
    public void commit(LedgerTransaction transaction) {
        Map<String, Long> expected = transaction.getExpectedVersions();
        List<String> redisKeys = expected.keySet().stream().map(this::redisKey).collect(Collectors.toList());

        List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.watch(redisKeys);

                StaleRecordException conflict = findConflict(ops, expected);
                if (conflict != null) {
                    ops.unwatch();
                    throw conflict;
                }

                ops.multi();
                for (LedgerRecord write : transaction.getWrites()) {
                    LedgerRecord stored = write.copy();
                    stored.setVersion(write.getVersion() + 1);
                    String key = redisKey(stored.ledgerKey());
                    ops.opsForValue().set(key, serialize(stored));
                    ops.opsForSet().add(indexKey(stored.recordType()), key);
                    if (stored.jobScope() != null) {
                        ops.opsForSet().add(jobIndexKey(stored.jobScope(), stored.recordType()), key);
                    }
                }
                return ops.exec();
            }
        });

        if (results == null || results.isEmpty()) {
            // EXEC aborted: a watched key changed between our read and the commit
            StaleRecordException conflict = findConflict(redisTemplate, expected);
            if (conflict != null) {
                throw conflict;
            }
            String firstKey = expected.keySet().iterator().next();
            throw new StaleRecordException(firstKey, expected.get(firstKey), -1);
        }
        log.debug("Committed {} record(s) to Redis ledger", transaction.getWrites().size());
    }

    @Override
    public String storeType() {
        return "redis";
    }

    private StaleRecordException findConflict(RedisOperations<String, String> ops, Map<String, Long> expected) {
        List<String> keys = new ArrayList<>(expected.keySet());
        List<String> current = ops.opsForValue().multiGet(
                keys.stream().map(this::redisKey).collect(Collectors.toList()));
        for (int i = 0; i < keys.size(); i++) {
            String json = current == null ? null : current.get(i);
            long actualVersion = json == null ? 0L : readVersion(json);
            long expectedVersion = expected.get(keys.get(i));
            if (actualVersion != expectedVersion) {
                return new StaleRecordException(keys.get(i), expectedVersion, actualVersion);
            }
        }
        return null;
    }

    private String redisKey(String ledgerKey) {
        return keyPrefix + ledgerKey;
    }

    private String indexKey(RecordType type) {
        return keyPrefix + "index:" + type.getPrefix();
    }

    private String jobIndexKey(long jobId, RecordType type) {
        return keyPrefix + "index:job:" + jobId + ":" + type.getPrefix();
    }

    // Members whose value has gone missing are skipped, as the snapshot script does.
    private <T extends LedgerRecord> List<T> readMembers(String setKey, Class<T> recordClass) {
        Set<String> members = redisTemplate.opsForSet().members(setKey);
        if (members == null || members.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> keys = new ArrayList<>(members);
        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        List<T> records = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            String json = values == null ? null : values.get(i);
            if (json != null) {
                String ledgerKey = keys.get(i).substring(keyPrefix.length());
                records.add(recordClass.cast(deserialize(ledgerKey, json)));
            }
        }
        return records;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger snapshot returned by Redis", e);
        }
    }

    private long readVersion(String json) {
        try {
            return objectMapper.readTree(json).path("version").asLong();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt ledger record in Redis", e);
        }
    }

    private String serialize(LedgerRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ledger record " + record.ledgerKey(), e);
        }
    }

    private LedgerRecord deserialize(String ledgerKey, String json) {
        try {
            return objectMapper.readValue(json, RecordType.ofKey(ledgerKey).getRecordClass());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize ledger record " + ledgerKey, e);
        }
    }
}
