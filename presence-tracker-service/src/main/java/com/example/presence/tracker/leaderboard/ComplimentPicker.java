package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.repository.ComplimentChoiceRepository;
import com.example.presence.shared.util.Constants.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Picks one compliment per user and period and remembers it, so every later board for the same
 * period shows the same text.
 * <p>
 * A new week or month pick avoids what the user already got in earlier weeks or months.
 * A new day pick avoids the user's current week and month compliments.
 */
@Component
@Slf4j
public class ComplimentPicker {

    private final ComplimentPool pool;
    private final ComplimentChoiceRepository choiceRepository;
    private final Random random;

    @Autowired
    public ComplimentPicker(ComplimentPool pool, ComplimentChoiceRepository choiceRepository) {
        this(pool, choiceRepository, new Random());
    }

    public ComplimentPicker(ComplimentPool pool, ComplimentChoiceRepository choiceRepository, Random random) {
        this.pool = pool;
        this.choiceRepository = choiceRepository;
        this.random = random;
    }

    public String forWeek(String userId, PeriodWindow week) {
        return forPeriod(userId, week, Scope.WEEK);
    }

    public String forMonth(String userId, PeriodWindow month) {
        return forPeriod(userId, month, Scope.MONTH);
    }

    public String forDay(String userId, PeriodWindow day, Set<String> avoid) {
        requireScope(day, Scope.DAY);
        return memoized(day.periodKey(), userId, () -> avoid);
    }

    private String forPeriod(String userId, PeriodWindow window, Scope scope) {
        requireScope(window, scope);
        return memoized(window.periodKey(), userId,
                () -> choiceRepository.findByPrefix(scope.periodPrefix(), userId));
    }

    private static void requireScope(PeriodWindow window, Scope expected) {
        if (window.scope() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " window but got " + window.scope());
        }
    }

    private String memoized(String periodKey, String userId, Supplier<Set<String>> exclusions) {
        Optional<String> saved = choiceRepository.find(periodKey, userId);
        if (saved.isPresent()) {
            return saved.get();
        }
        String chosen = choose(exclusions.get());
        choiceRepository.save(periodKey, userId, chosen);
        log.debug("Chose compliment '{}' for user {} in {}", chosen, userId, periodKey);
        return chosen;
    }

    String choose(Set<String> exclude) {
        List<String> candidates = new ArrayList<>(pool.all());
        candidates.removeAll(exclude);
        if (candidates.isEmpty()) {
            candidates = new ArrayList<>(pool.all());
        }
        return candidates.get(random.nextInt(candidates.size()));
    }
}
