package com.example.presence.shared.repository;

import com.example.presence.shared.exception.DurationStoreException;
import com.example.presence.shared.model.UserProfile;
import com.example.presence.shared.service.SqlQueryProvider;
import com.example.presence.shared.util.SqlKeys;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

@Repository
public class UserProfileRepository {

    private final JdbcTemplate jdbcTemplate;
    private final SqlQueryProvider sqlQueryProvider;

    public UserProfileRepository(JdbcTemplate jdbcTemplate, SqlQueryProvider sqlQueryProvider) {
        this.jdbcTemplate = jdbcTemplate;
        this.sqlQueryProvider = sqlQueryProvider;
    }

    private final RowMapper<UserProfile> profileRowMapper = new RowMapper<>() {
        @Override
        public UserProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp updatedAt = rs.getTimestamp("updated_at");
            return UserProfile.builder()
                    .userId(rs.getString("user_id"))
                    .displayName(rs.getString("display_name"))
                    .username(rs.getString("username"))
                    .updatedAt(updatedAt != null ? updatedAt.toInstant().atOffset(ZoneOffset.UTC) : null)
                    .build();
        }
    };

    public void upsert(UserProfile profile) {
        OffsetDateTime updatedAt = profile.getUpdatedAt() != null ? profile.getUpdatedAt() : OffsetDateTime.now(ZoneOffset.UTC);
        try {
            jdbcTemplate.update(sqlQueryProvider.getQuery(SqlKeys.PROFILE_UPSERT),
                    profile.getUserId(),
                    profile.getDisplayName(),
                    profile.getUsername(),
                    updatedAt);
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to store profile for " + profile.getUserId(), e);
        }
    }

    public Optional<UserProfile> findById(String userId) {
        try {
            return jdbcTemplate.query(sqlQueryProvider.getQuery(SqlKeys.PROFILE_FIND_BY_ID), profileRowMapper, userId)
                    .stream().findFirst();
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to read profile for " + userId, e);
        }
    }

    public List<UserProfile> findAll() {
        try {
            return jdbcTemplate.query(sqlQueryProvider.getQuery(SqlKeys.PROFILE_FIND_ALL), profileRowMapper);
        } catch (DataAccessException e) {
            throw new DurationStoreException("Failed to read profiles", e);
        }
    }
}
