package com.community.moderation.repository;

import com.community.moderation.entity.ModerationDecision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ModerationDecisionRepository extends JpaRepository<ModerationDecision, Long> {

    /**
     * 某内容的全部评估历史，最新在前
     */
    List<ModerationDecision> findByContentIdOrderByComputedAtDesc(String contentId);

    Optional<ModerationDecision> findFirstByContentIdOrderByComputedAtDesc(String contentId);

    // 分析窗口：[start, end)
    List<ModerationDecision> findByComputedAtGreaterThanEqualAndComputedAtLessThan(LocalDateTime start, LocalDateTime end);
}
