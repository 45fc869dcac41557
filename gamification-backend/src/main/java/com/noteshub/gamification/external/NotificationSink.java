package com.noteshub.gamification.external;

import java.util.Map;

/**
 * Fire-and-forget notification records. Implementations log failures and never throw.
 */
public interface NotificationSink {

    void enqueue(String userId, String type, Map<String, Object> payload);
}
