package com.strategyvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the event store.
 */
@Configuration
@ConfigurationProperties(prefix = "persistence")
@Data
public class PersistenceConfig {

    /**
     * Enable/disable event persistence globally
     */
    private boolean enabled = true;

    private RetentionConfig retention = new RetentionConfig();

    private CleanupConfig cleanup = new CleanupConfig();

    @Data
    public static class RetentionConfig {
        /**
         * Number of days to retain vault events
         */
        private int eventsDays = 90;
    }

    @Data
    public static class CleanupConfig {
        /**
         * Enable/disable automatic cleanup
         */
        private boolean enabled = true;

        /**
         * Cron expression for cleanup job
         */
        private String cron = "0 0 2 * * ?";
    }
}
