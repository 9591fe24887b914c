package com.community.moderation.repository;

import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.model.ContentType;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.Severity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ModerationQueueRepository extends JpaRepository<ModerationQueueItem, Long> {

    /**
     * 查找某内容当前未终结的队列项（用于"唯一活动项"约束）
     */
    Optional<ModerationQueueItem> findFirstByContentIdAndStatusIn(String contentId, Collection<QueueStatus> statuses);

    /**
     * 按条件筛选队列，null 表示不过滤。排序：严重程度降序，创建时间降序。
     */
    @Query("SELECT q FROM ModerationQueueItem q " +
           "WHERE (:status IS NULL OR q.status = :status) " +
           "AND (:severity IS NULL OR q.severity = :severity) " +
           "AND (:contentType IS NULL OR q.contentType = :contentType) " +
           "ORDER BY q.severityRank DESC, q.createdAt DESC, q.id DESC")
    List<ModerationQueueItem> search(@Param("status") QueueStatus status,
                                     @Param("severity") Severity severity,
                                     @Param("contentType") ContentType contentType,
                                     Pageable pageable);

    long countByStatus(QueueStatus status);

    long countByStatusInAndSeverity(Collection<QueueStatus> statuses, Severity severity);

    long countByStatusInAndAutoFlaggedTrue(Collection<QueueStatus> statuses);

    // 分析窗口内处理完成的队列项
    List<ModerationQueueItem> findByProcessedAtGreaterThanEqualAndProcessedAtLessThan(LocalDateTime start, LocalDateTime end);
}
