package com.noteshub.gamification.external;

public interface StudyGroupStore {

    long countCreated(String userId);

    long countJoined(String userId);
}
