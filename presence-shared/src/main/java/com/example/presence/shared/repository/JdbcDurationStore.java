package com.example.presence.shared.repository;

import com.example.presence.shared.aspect.Monitored;
import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.service.SqlQueryProvider;
import com.example.presence.shared.util.SqlKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Repository
@Slf4j
@Monitored("repository")
public class JdbcDurationStore implements DurationStore {

    private final JdbcTemplate jdbcTemplate;
    private final SqlQueryProvider sqlQueryProvider;

    public JdbcDurationStore(JdbcTemplate jdbcTemplate, SqlQueryProvider sqlQueryProvider) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlQueryProvider = sqlQueryProvider;
    }

    @Override
    public void addSeconds(LocalDate date, String userId, long deltaSeconds) {
        if (deltaSeconds <= 0) {
            return;
        }
        execute("add " + deltaSeconds + "s for user " + userId + " on " + date, () ->
                jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.TOTALS_ADD_SECONDS), date, userId, deltaSeconds));
        log.trace("Added {}s to user {} on {}", deltaSeconds, userId, date);
    }

    @Override
    public long getDaySeconds(String userId, LocalDate date) {
        return execute("read day total for user " + userId + " on " + date, () -> {
            List<Long> rows = jdbcTemplate.queryForList(sqlQueryProvider.getQuery(SqlKeys.TOTALS_FIND_DAY_SECONDS), Long.class, date, userId);
            return rows.isEmpty() || rows.get(0) == null ? 0L : rows.get(0);
        });
    }

    @Override
    public long sumSeconds(String userId, LocalDate from, LocalDate to) {
        return execute("sum seconds for user " + userId, () -> {
            Long total = jdbcTemplate.queryForObject(sqlQueryProvider.getQuery(SqlKeys.TOTALS_SUM_FOR_USER), Long.class, userId, from, to);
            return total == null ? 0L : total;
        });
    }

    @Override
    public Map<String, Long> sumSecondsByUser(LocalDate from, LocalDate to) {
        return execute("sum seconds between " + from + " and " + to, () -> {
            Map<String, Long> totals = new LinkedHashMap<>();
            jdbcTemplate.query(sqlQueryProvider.getQuery(SqlKeys.TOTALS_SUM_BY_USER),
                    rs -> {
                        totals.put(rs.getString("user_id"), rs.getLong("total_seconds"));
                    },
                    from, to);
            return totals;
        });
    }

    @Override
    public List<LocalDate> findTrackedDates(LocalDate from, LocalDate to) {
        return execute("find tracked dates", () ->
                jdbcTemplate.query(sqlQueryProvider.getQuery(SqlKeys.TOTALS_FIND_TRACKED_DATES),
                        (rs, rowNum) -> rs.getObject("stat_date", LocalDate.class), from, to));
    }

    @Override
    public long countDayTotals() {
        return execute("count day totals", () -> {
            Long count = jdbcTemplate.queryForObject(sqlQueryProvider.getQuery(SqlKeys.TOTALS_COUNT), Long.class);
            return count == null ? 0L : count;
        });
    }

    @Override
    public void deleteAllTotals() {
        int deleted = execute("delete all day totals", () ->
                jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.TOTALS_DELETE_ALL)));
        log.info("Deleted {} day total rows.", deleted);
    }

    @Override
    public Optional<String> getMeta(String key) {
        return execute("read meta " + key, () -> {
            List<String> rows = jdbcTemplate.queryForList(sqlQueryProvider.getQuery(SqlKeys.META_FIND), String.class, key);
            return rows.isEmpty() ? Optional.<String>empty() : Optional.ofNullable(rows.get(0));
        });
    }

    @Override
    public void setMeta(String key, String value) {
        execute("write meta " + key, () -> jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.META_UPSERT), key, value));
    }

    @Override
    public Map<String, String> getAllMeta() {
        return execute("read all meta", () -> {
            Map<String, String> meta = new LinkedHashMap<>();
            jdbcTemplate.query(sqlQueryProvider.getQuery(SqlKeys.META_FIND_ALL),
                    rs -> {
                        meta.put(rs.getString("meta_key"), rs.getString("meta_value"));
                    });
            return meta;
        });
    }

    @Override
    public void deleteMeta(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }
        String sql = String.format(
                sqlQueryProvider.getQuery(SqlKeys.META_DELETE_TEMPLATE),
                String.join(",", Collections.nCopies(keys.size(), "?"))
        );
        execute("delete meta " + keys, () -> jdbcTemplate.update(sql, keys.toArray()));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new DurationStoreException("Duration store failed to " + operation, e);
        }
    }
}
