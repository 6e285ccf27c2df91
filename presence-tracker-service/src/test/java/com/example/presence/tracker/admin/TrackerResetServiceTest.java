package com.example.presence.tracker.admin;

import com.example.presence.shared.config.AppProperties;
import com.example.presence.shared.repository.ComplimentChoiceRepository;
import com.example.presence.shared.util.Constants.MetaKeys;
import com.example.presence.tracker.leaderboard.AnchorService;
import com.example.presence.tracker.support.InMemoryDurationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TrackerResetServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 10);

    private InMemoryDurationStore store;
    private ComplimentChoiceRepository complimentRepository;
    private TrackerResetService resetService;

    @BeforeEach
    void setUp() {
        store = new InMemoryDurationStore();
        complimentRepository = mock(ComplimentChoiceRepository.class);
        AppProperties properties = new AppProperties();
        properties.setGroupKey("group-b");
        Clock clock = Clock.fixed(TODAY.atTime(12, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        resetService = new TrackerResetService(store, complimentRepository, new AnchorService(store), clock, properties);

        store.addSeconds(LocalDate.of(2024, 3, 1), "a", 900);
        store.setMeta(MetaKeys.ANCHOR_DATE, "2024-01-01");
        store.setMeta(MetaKeys.LAST_POST_DATE, "2024-03-09");
    }

    @Test
    void sameGroupKeepsEverything() {
        store.setMeta(MetaKeys.GROUP_KEY, "group-b");

        assertFalse(resetService.ensureGroupIdentity());

        assertEquals(1, store.countDayTotals());
        assertEquals(Optional.of("2024-01-01"), store.getMeta(MetaKeys.ANCHOR_DATE));
        verify(complimentRepository, never()).deleteAll();
    }

    @Test
    void changedGroupWipesTotalsAndStartsFromToday() {
        store.setMeta(MetaKeys.GROUP_KEY, "group-a");

        assertTrue(resetService.ensureGroupIdentity());

        assertEquals(0, store.countDayTotals());
        assertEquals(Optional.of("group-b"), store.getMeta(MetaKeys.GROUP_KEY));
        assertEquals(Optional.of("2024-03-10"), store.getMeta(MetaKeys.ANCHOR_DATE));
        assertEquals(Optional.of("2024-03-10"), store.getMeta(MetaKeys.GROUP_SINCE));
        assertEquals(Optional.empty(), store.getMeta(MetaKeys.LAST_POST_DATE));
        verify(complimentRepository).deleteAll();
    }

    @Test
    void firstStartWithoutGroupKeyAlsoResets() {
        assertTrue(resetService.ensureGroupIdentity());

        assertEquals(Optional.of("group-b"), store.getMeta(MetaKeys.GROUP_KEY));
    }

    @Test
    void hardResetKeepsTheGroupKey() {
        store.setMeta(MetaKeys.GROUP_KEY, "group-b");

        assertEquals(TODAY, resetService.hardReset());

        assertEquals(0, store.countDayTotals());
        assertEquals(Optional.of("group-b"), store.getMeta(MetaKeys.GROUP_KEY));
        assertEquals(Optional.of("2024-03-10"), store.getMeta(MetaKeys.ANCHOR_DATE));
    }
}
