package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.util.Constants.MetaKeys;
import com.example.presence.tracker.support.InMemoryDurationStore;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AnchorServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 15);

    private final InMemoryDurationStore store = new InMemoryDurationStore();
    private final AnchorService anchorService = new AnchorService(store);

    @Test
    void missingAnchorIsCreatedAsToday() {
        assertEquals(TODAY, anchorService.ensureAnchor(TODAY));
        assertEquals(Optional.of("2024-06-15"), store.getMeta(MetaKeys.ANCHOR_DATE));
    }

    @Test
    void storedAnchorWithTimePartIsReadAsDate() {
        store.setMeta(MetaKeys.ANCHOR_DATE, "2024-05-01T08:30:00+05:00");

        assertEquals(LocalDate.of(2024, 5, 1), anchorService.ensureAnchor(TODAY));
    }

    @Test
    void unreadableAnchorIsReplacedByToday() {
        store.setMeta(MetaKeys.ANCHOR_DATE, "not-a-date");

        assertEquals(TODAY, anchorService.ensureAnchor(TODAY));
        assertEquals(Optional.of(TODAY.toString()), store.getMeta(MetaKeys.ANCHOR_DATE));
    }

    @Test
    void readingTheAnchorNeverWritesIt() {
        assertEquals(Optional.empty(), anchorService.currentAnchor());

        store.setMeta(MetaKeys.ANCHOR_DATE, "garbage");

        assertEquals(Optional.empty(), anchorService.currentAnchor());
        assertEquals(Optional.of("garbage"), store.getMeta(MetaKeys.ANCHOR_DATE));
    }

    @Test
    void quoteRotatesFromTheAnchor() {
        QuoteOfTheDay quotes = new QuoteOfTheDay(List.of("q0", "q1", "q2"));

        assertEquals(Optional.of("q0"), quotes.forDay(TODAY, TODAY));
        assertEquals(Optional.of("q1"), quotes.forDay(TODAY, TODAY.plusDays(4)));
        assertEquals(Optional.of("q2"), quotes.forDay(TODAY, TODAY.minusDays(1)));
        assertEquals(Optional.empty(), new QuoteOfTheDay(List.of()).forDay(TODAY, TODAY));
    }
}
