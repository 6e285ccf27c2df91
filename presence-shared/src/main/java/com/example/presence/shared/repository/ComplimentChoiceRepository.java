package com.example.presence.shared.repository;

import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.service.SqlQueryProvider;
import com.example.presence.shared.util.SqlKeys;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Memo of the compliment chosen for a user in a given period, keyed by
 * {@code day:<date>}, {@code week:<start>} or {@code month:<start>}.
 */
@Repository
public class ComplimentChoiceRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SqlQueryProvider sqlQueryProvider;

    public ComplimentChoiceRepository(JdbcTemplate jdbcTemplate, SqlQueryProvider sqlQueryProvider) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlQueryProvider = sqlQueryProvider;
    }

    public Optional<String> find(String periodKey, String userId) {
        try {
            List<String> rows = jdbcTemplate.queryForList(sqlQueryProvider.getQuery(SqlKeys.COMPLIMENT_FIND), String.class, periodKey, userId);
            return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to read compliment for " + periodKey + "/" + userId, e);
        }
    }

    /**
     * All compliments ever stored for the user under keys starting with {@code prefix}.
     */
    public Set<String> findByPrefix(String prefix, String userId) {
        try {
            return new LinkedHashSet<>(jdbcTemplate.queryForList(
                    sqlQueryProvider.getQuery(SqlKeys.COMPLIMENT_FIND_BY_PREFIX), String.class, prefix + "%", userId));
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to read compliments with prefix " + prefix + " for " + userId, e);
        }
    }

    public void save(String periodKey, String userId, String compliment) {
        try {
            jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.COMPLIMENT_UPSERT), periodKey, userId, compliment);
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to store compliment for " + periodKey + "/" + userId, e);
        }
    }

    public long count() {
        try {
            Long count = jdbcTemplate.queryForObject(sqlQueryProvider.getQuery(SqlKeys.COMPLIMENT_COUNT), Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to count compliment choices", e);
        }
    }

    public int deleteAll() {
        try {
            return jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.COMPLIMENT_DELETE_ALL));
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to delete compliments", e);
        }
    }
}
