package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.UserStreak;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Every streak transition is one UPDATE guarded on the last activity date the caller observed,
 * so a transition computed from stale state touches no row.
 */
@Repository
public interface UserStreakRepository extends JpaRepository<UserStreak, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM UserStreak s WHERE s.userId = :userId")
    Optional<UserStreak> findAndLockByUserId(@Param("userId") String userId);

    /**
     * Same UTC day (or a clock running behind): only the activity counter moves.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserStreak s SET s.totalActivities = s.totalActivities + 1, s.lastActivityAt = :now " +
           "WHERE s.userId = :userId AND s.lastActivityDate = :observedDate")
    int touch(@Param("userId") String userId,
              @Param("observedDate") LocalDate observedDate,
              @Param("now") LocalDateTime now);

    /**
     * Consecutive day. longest is assigned before current so that both standard SQL
     * (old values on the right-hand side) and MySQL (left-to-right) produce the same result.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserStreak s SET " +
           "s.longestStreak = CASE WHEN s.currentStreak + 1 > s.longestStreak THEN s.currentStreak + 1 ELSE s.longestStreak END, " +
           "s.currentStreak = s.currentStreak + 1, " +
           "s.lastActivityDate = :today, s.lastActivityAt = :now, s.totalActivities = s.totalActivities + 1 " +
           "WHERE s.userId = :userId AND s.lastActivityDate = :observedDate")
    int extend(@Param("userId") String userId,
               @Param("observedDate") LocalDate observedDate,
               @Param("today") LocalDate today,
               @Param("now") LocalDateTime now);

    /**
     * Gap of more than one day: start over at 1, longest untouched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserStreak s SET s.currentStreak = 1, " +
           "s.lastActivityDate = :today, s.lastActivityAt = :now, s.totalActivities = s.totalActivities + 1 " +
           "WHERE s.userId = :userId AND s.lastActivityDate = :observedDate")
    int restart(@Param("userId") String userId,
                @Param("observedDate") LocalDate observedDate,
                @Param("today") LocalDate today,
                @Param("now") LocalDateTime now);

    /**
     * First activity on a zero-state row created at registration.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserStreak s SET s.currentStreak = 1, " +
           "s.longestStreak = CASE WHEN s.longestStreak < 1 THEN 1 ELSE s.longestStreak END, " +
           "s.lastActivityDate = :today, s.lastActivityAt = :now, s.totalActivities = s.totalActivities + 1 " +
           "WHERE s.userId = :userId AND s.lastActivityDate IS NULL")
    int begin(@Param("userId") String userId,
              @Param("today") LocalDate today,
              @Param("now") LocalDateTime now);
}
