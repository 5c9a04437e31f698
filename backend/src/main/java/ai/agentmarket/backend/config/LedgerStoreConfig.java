package ai.agentmarket.backend.config;

import ai.agentmarket.backend.store.InMemoryLedgerStore;
import ai.agentmarket.backend.store.InMemorySequenceGenerator;
import ai.agentmarket.backend.store.LedgerStore;
import ai.agentmarket.backend.store.RedisLedgerStore;
import ai.agentmarket.backend.store.RedisSequenceGenerator;
import ai.agentmarket.backend.store.SequenceGenerator;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Clock;

/**
 * Selects the ledger backing store from {@code marketplace.store.type}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MarketplaceProperties.class)
public class LedgerStoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "marketplace.store.type", havingValue = "memory", matchIfMissing = true)
    public LedgerStore inMemoryLedgerStore() {
        log.info("Using in-memory ledger store");
        return new InMemoryLedgerStore();
    }

    @Bean
    @ConditionalOnProperty(name = "marketplace.store.type", havingValue = "memory", matchIfMissing = true)
    public SequenceGenerator inMemorySequenceGenerator() {
        return new InMemorySequenceGenerator();
    }

    @Bean
    @ConditionalOnProperty(name = "marketplace.store.type", havingValue = "redis")
    public LedgerStore redisLedgerStore(@Qualifier("ledgerRedisTemplate") RedisTemplate<String, String> ledgerRedisTemplate,
                                        MarketplaceProperties properties) {
        log.info("Using Redis ledger store with key prefix '{}'", properties.getStore().getKeyPrefix());
        return new RedisLedgerStore(ledgerRedisTemplate, ledgerObjectMapper(), properties.getStore().getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "marketplace.store.type", havingValue = "redis")
    public SequenceGenerator redisSequenceGenerator(@Qualifier("ledgerRedisTemplate") RedisTemplate<String, String> ledgerRedisTemplate,
                                                    MarketplaceProperties properties) {
        return new RedisSequenceGenerator(ledgerRedisTemplate, properties.getStore().getKeyPrefix());
    }

    /**
     * Mapper for stored records: ISO-8601 instants and plain decimal strings.
     */
    static ObjectMapper ledgerObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules(); // Support for Java 8 time types
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        return objectMapper;
    }
}
