package com.community.moderation.repository;

import com.community.moderation.entity.UserReputation;
import com.community.moderation.model.TrustTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface UserReputationRepository extends JpaRepository<UserReputation, String> {

    List<UserReputation> findByUserIdIn(Collection<String> userIds);

    long countByTrustTier(TrustTier trustTier);
}
