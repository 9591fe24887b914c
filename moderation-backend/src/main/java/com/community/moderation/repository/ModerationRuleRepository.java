package com.community.moderation.repository;

import com.community.moderation.entity.ModerationRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ModerationRuleRepository extends JpaRepository<ModerationRule, String> {

    List<ModerationRule> findAllByOrderByPriorityDescRuleIdAsc();

    /**
     * 累加命中计数（内存计数器定期刷入）
     */
    @Modifying
    @Query("UPDATE ModerationRule r SET r.timesTriggered = r.timesTriggered + :delta, " +
           "r.lastTriggeredAt = :triggeredAt WHERE r.ruleId = :ruleId")
    int incrementTriggerCount(@Param("ruleId") String ruleId,
                              @Param("delta") long delta,
                              @Param("triggeredAt") LocalDateTime triggeredAt);
}
