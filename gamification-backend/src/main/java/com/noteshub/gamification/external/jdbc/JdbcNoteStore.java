package com.noteshub.gamification.external.jdbc;

import com.noteshub.gamification.external.NoteStore;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Reads the notes and downloads tables.
 */
@Component
public class JdbcNoteStore implements NoteStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcNoteStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countUploads(String userId, boolean approvedOnly) {
        String sql = approvedOnly
                ? "SELECT COUNT(*) FROM notes WHERE user_id = :userId AND is_approved = TRUE"
                : "SELECT COUNT(*) FROM notes WHERE user_id = :userId";
        return queryForLong(sql, new MapSqlParameterSource("userId", userId));
    }

    @Override
    public long sumDownloadCount(String userId) {
        return queryForLong("SELECT COALESCE(SUM(download_count), 0) FROM notes WHERE user_id = :userId",
                new MapSqlParameterSource("userId", userId));
    }

    @Override
    public long countDownloadsBy(String userId) {
        return queryForLong("SELECT COUNT(*) FROM downloads WHERE user_id = :userId",
                new MapSqlParameterSource("userId", userId));
    }

    @Override
    public Map<String, Long> countApprovedUploadsByUser(Collection<String> userIds) {
        return groupedLongs("SELECT user_id, COUNT(*) AS total FROM notes " +
                "WHERE is_approved = TRUE AND user_id IN (:userIds) GROUP BY user_id", userIds);
    }

    @Override
    public Map<String, Long> sumDownloadCountByUser(Collection<String> userIds) {
        return groupedLongs("SELECT user_id, COALESCE(SUM(download_count), 0) AS total FROM notes " +
                "WHERE user_id IN (:userIds) GROUP BY user_id", userIds);
    }

    private Map<String, Long> groupedLongs(String sql, Collection<String> userIds) {
        Map<String, Long> result = new HashMap<>();
        if (userIds == null || userIds.isEmpty()) {
            return result;
        }
        jdbcTemplate.query(sql, new MapSqlParameterSource("userIds", userIds),
                rs -> {
                    result.put(rs.getString("user_id"), rs.getLong("total"));
                });
        return result;
    }

    private long queryForLong(String sql, MapSqlParameterSource params) {
        Long value = jdbcTemplate.queryForObject(sql, params, Long.class);
        return value == null ? 0 : value;
    }
}
