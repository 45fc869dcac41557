package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.MilestoneClaim;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MilestoneClaimRepository extends JpaRepository<MilestoneClaim, Long> {

    List<MilestoneClaim> findByUserId(String userId);
}
