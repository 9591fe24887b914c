package com.community.moderation.repository;

import com.community.moderation.entity.FeedbackVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface FeedbackVoteRepository extends JpaRepository<FeedbackVote, Long> {

    Optional<FeedbackVote> findByQueueItemIdAndVoterId(Long queueItemId, String voterId);

    List<FeedbackVote> findByQueueItemId(Long queueItemId);

    List<FeedbackVote> findBySubmittedAtGreaterThanEqualAndSubmittedAtLessThan(LocalDateTime start, LocalDateTime end);
}
