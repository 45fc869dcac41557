package com.noteshub.gamification.external.jdbc;

import com.noteshub.gamification.external.SocialGraph;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcSocialGraph implements SocialGraph {

    private final JdbcTemplate jdbcTemplate;

    public JdbcSocialGraph(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long countFollowers(String userId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM follows WHERE following_id = ?", Long.class, userId);
        return count == null ? 0 : count;
    }

    @Override
    public long countFollowing(String userId) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM follows WHERE follower_id = ?", Long.class, userId);
        return count == null ? 0 : count;
    }
}
