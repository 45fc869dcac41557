package com.noteshub.gamification.external;

import java.util.List;
import java.util.Optional;

/**
 * Platform user directory.
 */
public interface UserDirectory {

    Optional<UserProfile> getUser(String userId);

    List<UserProfile> findAll();

    List<UserProfile> findByCollege(String college);

    List<UserProfile> findByDepartment(String department);

    long countAll();
}
