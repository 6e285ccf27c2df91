package com.example.presence.shared.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the roster poll, checkpoint and leaderboard jobs for every profile
 * except 'no-scheduling', which admin tooling and tests use to run against the
 * same database without driving the tracker.
 */
@Configuration
@EnableScheduling
@Profile("!no-scheduling")
public class SchedulingConditionalConfig {
}
