package com.example.presence.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "presence")
    public AppProperties appProperties() {
        // Binding of presence.session.*, presence.leaderboard.*, etc. is handled by @ConfigurationProperties
        return new AppProperties();
    }

    @Bean
    public ZoneId trackerZone(AppProperties appProperties) {
        return ZoneId.of(appProperties.getZone());
    }

    @Bean
    public Clock trackerClock(ZoneId trackerZone) {
        return Clock.system(trackerZone);
    }
}
