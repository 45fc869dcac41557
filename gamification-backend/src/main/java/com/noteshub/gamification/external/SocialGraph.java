package com.noteshub.gamification.external;

public interface SocialGraph {

    long countFollowers(String userId);

    long countFollowing(String userId);
}
