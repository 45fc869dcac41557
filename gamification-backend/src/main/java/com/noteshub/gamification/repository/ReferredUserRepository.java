package com.noteshub.gamification.repository;

import com.noteshub.gamification.entity.ReferredUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReferredUserRepository extends JpaRepository<ReferredUser, Long> {

    List<ReferredUser> findByReferrerIdOrderByJoinedAtAscReferredIdAsc(String referrerId);
}
