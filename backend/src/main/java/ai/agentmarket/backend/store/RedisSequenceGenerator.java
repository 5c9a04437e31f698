package ai.agentmarket.backend.store;

import org.springframework.data.redis.core.RedisTemplate;

/**
 * Sequences backed by Redis INCR, shared by every instance using the same key prefix.
 */
public class RedisSequenceGenerator implements SequenceGenerator {

    private final RedisTemplate<String, String> redisTemplate;
    private final String keyPrefix;

    public RedisSequenceGenerator(RedisTemplate<String, String> redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public long next(String sequence) {
        Long value = redisTemplate.opsForValue().increment(keyPrefix + "seq:" + sequence);
        if (value == null) {
            throw new IllegalStateException("Redis returned no value for sequence " + sequence);
        }
        return value;
    }
}
