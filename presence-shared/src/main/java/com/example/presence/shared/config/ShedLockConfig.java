package com.example.presence.shared.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Configuration for ShedLock.
 * The tracker keeps all session state in memory, so exactly one process may run the
 * scheduled jobs against a database at a time; the lock table enforces that.
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "PT5M")
@Profile("!no-scheduling")
public class ShedLockConfig {

    /**
     * Creates the LockProvider bean backed by the shedlock table.
     * @param dataSource The application's configured data source.
     * @return A configured LockProvider.
     */
    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(
            JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(new JdbcTemplate(dataSource))
                .usingDbTime()
                .build()
        );
    }
}
