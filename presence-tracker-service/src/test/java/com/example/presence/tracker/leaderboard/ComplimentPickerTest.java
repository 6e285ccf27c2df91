package com.example.presence.tracker.leaderboard;

import com.example.presence.shared.repository.ComplimentChoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ComplimentPickerTest {

    private static final LocalDate ANCHOR = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_9 = LocalDate.of(2024, 1, 9);
    private static final PeriodWindow WEEK = PeriodWindows.week(ANCHOR, JAN_9);

    private ComplimentChoiceRepository repository;
    private ComplimentPool pool;
    private ComplimentPicker picker;

    @BeforeEach
    void setUp() {
        repository = mock(ComplimentChoiceRepository.class);
        pool = new ComplimentPool(List.of("[focus]", "Steady Hands", "Iron Discipline"));
        picker = new ComplimentPicker(pool, repository, new Random(42));
    }

    @Test
    void poolSkipsSectionHeadersAndDropsDuplicates() {
        assertFalse(pool.all().contains("[focus]"));
        assertEquals("Steady Hands", pool.all().get(0));
        assertEquals(pool.all().size(), Set.copyOf(pool.all()).size());
    }

    @Test
    void storedChoiceIsReturnedWithoutPickingAgain() {
        when(repository.find("week:2024-01-08", "a")).thenReturn(Optional.of("Steady Hands"));

        assertEquals("Steady Hands", picker.forWeek("a", WEEK));
        verify(repository, never()).save(anyString(), anyString(), anyString());
    }

    @Test
    void newWeekAvoidsEarlierWeekCompliments() {
        Set<String> earlier = Set.copyOf(pool.all().subList(1, pool.all().size()));
        when(repository.find("week:2024-01-08", "a")).thenReturn(Optional.empty());
        when(repository.findByPrefix("week:", "a")).thenReturn(earlier);

        String chosen = picker.forWeek("a", WEEK);

        assertEquals("Steady Hands", chosen);
        verify(repository).save("week:2024-01-08", "a", "Steady Hands");
    }

    @Test
    void dayPickAvoidsCurrentWeekAndMonthChoices() {
        Set<String> avoid = Set.copyOf(pool.all().subList(1, pool.all().size()));
        when(repository.find("day:2024-01-09", "a")).thenReturn(Optional.empty());

        assertEquals("Steady Hands", picker.forDay("a", PeriodWindows.day(ANCHOR, JAN_9), avoid));
    }

    @Test
    void monthKeyFollowsTheAnchoredBlockStart() {
        PeriodWindow month = PeriodWindows.month(ANCHOR.minusDays(10), JAN_9);
        when(repository.find(month.periodKey(), "a")).thenReturn(Optional.empty());

        picker.forMonth("a", month);

        assertEquals("month:2023-12-22", month.periodKey());
        verify(repository).save(eq("month:2023-12-22"), eq("a"), anyString());
    }

    @Test
    void windowOfAnotherScopeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> picker.forMonth("a", WEEK));
        verify(repository, never()).save(anyString(), anyString(), anyString());
    }

    @Test
    void exhaustedPoolFallsBackToEveryCompliment() {
        String chosen = picker.choose(Set.copyOf(pool.all()));

        assertTrue(pool.all().contains(chosen));
    }
}
