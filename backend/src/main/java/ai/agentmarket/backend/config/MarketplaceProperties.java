package ai.agentmarket.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings under {@code marketplace.*}. The JWT secret and admin settings are read with
 * {@code @Value} by the security components.
 */
@Data
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    private Store store = new Store();
    private Query query = new Query();

    @Data
    public static class Store {

        /**
         * "memory" or "redis".
         */
        private String type = "memory";

        private String keyPrefix = "agentmarket:";
    }

    @Data
    public static class Query {

        private int defaultLimit = 100;

        private int maxLimit = 500;

        /**
         * Effective page size: the default when absent, clamped to 1..maxLimit otherwise.
         */
        public int resolveLimit(Integer requested) {
            int max = Math.max(1, maxLimit);
            if (requested == null) {
                return Math.min(Math.max(1, defaultLimit), max);
            }
            return Math.min(Math.max(1, requested), max);
        }
    }
}
