package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.PointsHistory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PointsHistoryRepository extends JpaRepository<PointsHistory, Long> {

    // newest first; the service flips the page back into chronological order
    List<PointsHistory> findByUserIdOrderByCreatedAtDescHistoryIdDesc(String userId, Pageable pageable);

    long countByUserId(String userId);
}
