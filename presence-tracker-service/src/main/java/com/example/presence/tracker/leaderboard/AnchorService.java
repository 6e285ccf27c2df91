package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.repository.DurationStore;
import com.example.presence.shared.util.Constants.MetaKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnchorService {

    private final DurationStore durationStore;

    /**
     * Returns the stored anchor, creating it as {@code today} when missing or unreadable.
     */
    public LocalDate ensureAnchor(LocalDate today) {
        Optional<LocalDate> stored = currentAnchor();
        if (stored.isPresent()) {
            return stored.get();
        }
        reanchor(today);
        return today;
    }

    /**
     * Reads the stored anchor without creating or repairing it.
     */
    public Optional<LocalDate> currentAnchor() {
        Optional<String> stored = durationStore.getMeta(MetaKeys.ANCHOR_DATE);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        String value = stored.get().trim();
        try {
            // Older values may carry a time part
            return Optional.of(LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value));
        } catch (DateTimeParseException e) {
            log.warn("Stored anchor_date '{}' is not a date.", value);
            return Optional.empty();
        }
    }

    public void reanchor(LocalDate date) {
        durationStore.setMeta(MetaKeys.ANCHOR_DATE, date.toString());
        log.info("Anchor set to {}.", date);
    }
}
