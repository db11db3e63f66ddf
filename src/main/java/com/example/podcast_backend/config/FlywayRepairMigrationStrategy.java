package com.example.podcast_backend.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Repairs the schema history (checksums of edited migrations, failed entries) before migrating.
 * Disable with {@code app.flyway.repair-on-start=false} once environments are aligned.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.flyway", name = "repair-on-start", havingValue = "true", matchIfMissing = true)
public class FlywayRepairMigrationStrategy {

    @Bean
    public FlywayMigrationStrategy repairThenMigrateStrategy() {
        return flyway -> {
            flyway.repair();
            flyway.migrate();
        };
    }
}
