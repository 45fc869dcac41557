package com.noteshub.gamification.external.jdbc;

import com.noteshub.gamification.external.StudyGroupStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcStudyGroupStore implements StudyGroupStore {

    private final JdbcTemplate jdbcTemplate;

    public JdbcStudyGroupStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countCreated(String userId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM study_groups WHERE created_by = ?", Long.class, userId);
        return count == null ? 0 : count;
    }

    @Override
    public long countJoined(String userId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM study_group_members WHERE user_id = ?", Long.class, userId);
        return count == null ? 0 : count;
    }
}
