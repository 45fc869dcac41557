package com.noteshub.gamification.external.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.noteshub.gamification.external.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Writes notification rows for the platform's notification feed.
 * Failures are logged and dropped: a missing notification must never fail the action behind it.
 */
@Component
public class JdbcNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcNotificationSink.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcNotificationSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void enqueue(String userId, String type, Map<String, Object> payload) {
        try {
            String json = objectMapper.writeValueAsString(payload == null ? Map.of() : payload);
            jdbcTemplate.update(
                    "INSERT INTO notifications (user_id, type, payload, is_read, created_at) VALUES (?, ?, ?, FALSE, ?)",
                    userId, type, json, LocalDateTime.now(clock));
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Dropping {} notification for user {}: {}", type, userId, e.getMessage());
        }
    }
}
