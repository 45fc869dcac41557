package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.UserPoints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface UserPointsRepository extends JpaRepository<UserPoints, String> {

    /**
     * Adds points in the database; concurrent awards for one user never overwrite each other.
     * @return number of rows touched, 0 when the user has no points row yet
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserPoints p SET p.totalPoints = p.totalPoints + :points, p.updatedAt = :now WHERE p.userId = :userId")
    int incrementTotal(@Param("userId") String userId, @Param("points") long points, @Param("now") LocalDateTime now);

    /**
     * Writes the derived level only if the total is still the one it was derived from.
     * A racing award recomputes for its own, newer total.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserPoints p SET p.level = :level, p.levelName = :levelName " +
           "WHERE p.userId = :userId AND p.totalPoints = :expectedTotal")
    int updateLevelIfTotal(@Param("userId") String userId,
                           @Param("expectedTotal") long expectedTotal,
                           @Param("level") int level,
                           @Param("levelName") String levelName);
}
