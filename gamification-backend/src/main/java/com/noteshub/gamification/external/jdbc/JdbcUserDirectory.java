package com.noteshub.gamification.external.jdbc;

import com.noteshub.gamification.external.UserDirectory;
import com.noteshub.gamification.external.UserProfile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Reads the platform's users table.
 */
@Component
public class JdbcUserDirectory implements UserDirectory {

    private static final String SELECT_USER =
            "SELECT id, usn, department, college, study_year, profile_picture FROM users";

    private static final RowMapper<UserProfile> USER_MAPPER = (rs, rowNum) -> new UserProfile(
            rs.getString("id"),
            rs.getString("usn"),
            rs.getString("department"),
            rs.getString("college"),
            (Integer) rs.getObject("study_year", Integer.class),
            rs.getString("profile_picture"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserProfile> getUser(String userId) {
        List<UserProfile> rows = jdbcTemplate.query(SELECT_USER + " WHERE id = ?", USER_MAPPER, userId);
        return rows.stream().findFirst();
    }

    @Override
    public List<UserProfile> findAll() {
        return jdbcTemplate.query(SELECT_USER + " ORDER BY id", USER_MAPPER);
    }

    @Override
    public List<UserProfile> findByCollege(String college) {
        return jdbcTemplate.query(SELECT_USER + " WHERE college = ? ORDER BY id", USER_MAPPER, college);
    }

    @Override
    public List<UserProfile> findByDepartment(String department) {
        return jdbcTemplate.query(SELECT_USER + " WHERE department = ? ORDER BY id", USER_MAPPER, department);
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM users", Long.class);
        return count == null ? 0 : count;
    }
}
