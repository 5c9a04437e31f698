package ai.agentmarket.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis connection for the ledger store. Only active when {@code marketplace.store.type=redis}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "marketplace.store.type", havingValue = "redis")
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${spring.data.redis.password:}")
    private String redisPassword;

    @Value("${spring.data.redis.database:0}")
    private int redisDatabase;

    @Value("${spring.application.name:agentmarket-backend}")
    private String clientName;

    @Value("${marketplace.store.command-timeout:2s}")
    private Duration commandTimeout;

    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        log.info("Connecting ledger store to Redis {}:{} (database {}, timeout {})",
                redisHost, redisPort, redisDatabase, commandTimeout);

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(redisHost, redisPort);
        server.setDatabase(redisDatabase);
        if (redisPassword != null && !redisPassword.isBlank()) {
            server.setPassword(redisPassword);
        }

        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(commandTimeout)
                .clientName(clientName)
                .build();

        return new LettuceConnectionFactory(server, client);
    }

    /**
     * String keys and values. The store writes each record as a JSON document and runs its
     * snapshot script through this template, so every serializer must be the string one.
     */
    @Bean
    public RedisTemplate<String, String> ledgerRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
