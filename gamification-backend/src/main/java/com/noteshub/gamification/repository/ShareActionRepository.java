package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.ShareAction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ShareActionRepository extends JpaRepository<ShareAction, Long> {

    long countByUserId(String userId);

    // [platform, count]
    @Query("SELECT s.platform, COUNT(s) FROM ShareAction s WHERE s.userId = :userId GROUP BY s.platform")
    List<Object[]> countByPlatform(@Param("userId") String userId);
}
