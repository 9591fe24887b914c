package com.community.moderation.repository;

import com.community.moderation.entity.ContentReport;
import com.community.moderation.model.ReportStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface ContentReportRepository extends JpaRepository<ContentReport, Long> {

    /**
     * 同一举报人对同一内容是否已有未处理的举报
     */
    boolean existsByContentIdAndReporterIdAndStatusIn(String contentId, String reporterId, Collection<ReportStatus> statuses);

    List<ContentReport> findByQueueItemIdAndStatusIn(Long queueItemId, Collection<ReportStatus> statuses);

    List<ContentReport> findByQueueItemId(Long queueItemId);

    List<ContentReport> findByReporterIdOrderByCreatedAtDesc(String reporterId, Pageable pageable);

    List<ContentReport> findByReporterIdAndStatusOrderByCreatedAtDesc(String reporterId, ReportStatus status, Pageable pageable);

    List<ContentReport> findByStatusOrderByCreatedAtDesc(ReportStatus status, Pageable pageable);

    List<ContentReport> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<ContentReport> findByResolvedAtGreaterThanEqualAndResolvedAtLessThan(LocalDateTime start, LocalDateTime end);
}
