package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Rotates through the configured quotes, one per day counted from the anchor.
 */
@Component
@Slf4j
public class QuoteOfTheDay {

    private final List<String> quotes;

    @Autowired
    public QuoteOfTheDay(ResourceLoader resourceLoader, AppProperties appProperties) {
        this(TextResources.readLines(resourceLoader.getResource(appProperties.getLeaderboard().getQuotesLocation())));
    }

    public QuoteOfTheDay(List<String> quotes) {
        this.quotes = List.copyOf(quotes);
        log.info("Loaded {} quotes.", this.quotes.size());
    }

    public Optional<String> forDay(LocalDate anchor, LocalDate date) {
        if (quotes.isEmpty()) {
            return Optional.empty();
        }
        long days = ChronoUnit.DAYS.between(anchor, date);
        return Optional.of(quotes.get((int) Math.floorMod(days, (long) quotes.size())));
    }
}
