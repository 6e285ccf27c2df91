package com.example.presence.shared.repository;

import com.example.presence.shared.exception.DurationStoreException;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-day, per-user seconds ledger plus tracker metadata.
 * <p>
 * Assumes a single writer. Every method reports failure by throwing
 * {@link DurationStoreException}; nothing is dropped silently.
 */
public interface DurationStore {

    /**
     * Adds {@code deltaSeconds} to the user's total for {@code date}. A non-positive delta is a no-op.
     */
    void addSeconds(LocalDate date, String userId, long deltaSeconds);

    long getDaySeconds(String userId, LocalDate date);

    /**
     * Sum of the user's seconds over the inclusive date range.
     */
    long sumSeconds(String userId, LocalDate from, LocalDate to);

    /**
     * Positive per-user sums over the inclusive date range, keyed by raw user id.
     */
    Map<String, Long> sumSecondsByUser(LocalDate from, LocalDate to);

    /**
     * Distinct dates in the inclusive range that carry any stored seconds, ascending.
     */
    List<LocalDate> findTrackedDates(LocalDate from, LocalDate to);

    long countDayTotals();

    void deleteAllTotals();

    Optional<String> getMeta(String key);

    void setMeta(String key, String value);

    Map<String, String> getAllMeta();

    void deleteMeta(Collection<String> keys);
}
