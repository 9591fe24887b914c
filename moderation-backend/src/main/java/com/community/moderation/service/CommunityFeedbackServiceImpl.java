package com.community.moderation.service;

import com.community.moderation.config.ModerationProperties;
import com.community.moderation.dto.FeedbackConsensus;
import com.community.moderation.dto.FeedbackSubmission;
import com.community.moderation.entity.FeedbackVote;
import com.community.moderation.entity.ModerationQueueItem;
import com.community.moderation.exception.ForbiddenException;
import com.community.moderation.exception.NotFoundException;
import com.community.moderation.exception.ValidationException;
import com.community.moderation.model.QueueStatus;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.SeverityRating;
import com.community.moderation.repository.FeedbackVoteRepository;
import com.community.moderation.repository.ModerationQueueRepository;
import com.community.moderation.util.ContentLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class CommunityFeedbackServiceImpl implements CommunityFeedbackService {

    private static final Logger log = LoggerFactory.getLogger(CommunityFeedbackServiceImpl.class);

    private final FeedbackVoteRepository voteRepository;
    private final ModerationQueueRepository queueRepository;
    private final ReputationService reputationService;
    private final ReputationAlgorithm reputationAlgorithm;
    private final RuleService ruleService;
    private final FeedbackAggregator aggregator;
    private final ContentLockRegistry lockRegistry;
    private final TransactionTemplate transactionTemplate;
    private final ModerationProperties properties;
    private final Clock clock;

    public CommunityFeedbackServiceImpl(FeedbackVoteRepository voteRepository,
                                        ModerationQueueRepository queueRepository,
                                        ReputationService reputationService,
                                        ReputationAlgorithm reputationAlgorithm,
                                        RuleService ruleService,
                                        FeedbackAggregator aggregator,
                                        ContentLockRegistry lockRegistry,
                                        TransactionTemplate transactionTemplate,
                                        ModerationProperties properties,
                                        Clock clock) {
        this.voteRepository = voteRepository;
        this.queueRepository = queueRepository;
        this.reputationService = reputationService;
        this.reputationAlgorithm = reputationAlgorithm;
        this.ruleService = ruleService;
        this.aggregator = aggregator;
        this.lockRegistry = lockRegistry;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public FeedbackSubmission submitVote(Long queueItemId, String voterId, boolean wasAccurate, SeverityRating severityRating) {
        if (severityRating == null) {
            throw new ValidationException("severityRating is required");
        }
        ModerationQueueItem item = findItem(queueItemId);
        if (!item.getStatus().isTerminal()) {
            throw new ValidationException("Only resolved queue items accept feedback: " + queueItemId);
        }

        ReputationSnapshot voter = reputationService.getSnapshot(voterId);
        if (voter.getOverallScore() < properties.getFeedback().getMinVoterScore()) {
            throw new ForbiddenException("Reputation of at least "
                    + properties.getFeedback().getMinVoterScore() + " is required to vote");
        }

        // 与队列处理共用内容锁，保证阈值调整对每个队列项最多一次
        return lockRegistry.withLock(item.getContentId(), () -> transactionTemplate.execute(status -> {
            LocalDateTime now = LocalDateTime.now(clock);
            ModerationQueueItem current = findItem(queueItemId);

            // --- 1. 写入或覆盖投票 ---
            Optional<FeedbackVote> existing = voteRepository.findByQueueItemIdAndVoterId(queueItemId, voterId);
            FeedbackVote vote = existing.orElseGet(FeedbackVote::new);
            if (existing.isEmpty()) {
                vote.setQueueItemId(queueItemId);
                vote.setContentId(current.getContentId());
                vote.setVoterId(voterId);
                vote.setSubmittedAt(now);
            } else {
                vote.setUpdatedAt(now);
            }
            vote.setWasAccurate(wasAccurate);
            vote.setSeverityRating(severityRating);
            vote.setVoterTier(voter.getTrustTier());
            vote.setVoterReputationWeight(voter.getTrustTier().getVoteWeight());
            FeedbackVote saved = voteRepository.save(vote);

            // --- 2. 投票人奖励：与审核结果一致，且为首次投票 ---
            boolean agreesWithResolution = wasAccurate == (current.getStatus() == QueueStatus.REJECTED);
            if (existing.isEmpty() && agreesWithResolution) {
                reputationService.applyDelta(voterId, reputationAlgorithm.accurateVoteReward());
            }

            // --- 3. 聚合并按需调整规则阈值 ---
            List<FeedbackVote> votes = voteRepository.findByQueueItemId(queueItemId);
            FeedbackConsensus consensus = aggregator.aggregate(queueItemId, votes);
            FeedbackSubmission submission = new FeedbackSubmission(saved, existing.isPresent(), consensus, null, null);
            maybeAdjustThreshold(current, consensus, submission);

            log.info("用户 {} 对队列项 {} 投票: accurate={}, rating={}, weight={}",
                    voterId, queueItemId, wasAccurate, severityRating.getCode(), saved.getVoterReputationWeight());
            return submission;
        }));
    }

    @Override
    public FeedbackConsensus getConsensus(Long queueItemId) {
        findItem(queueItemId);
        return aggregator.aggregate(queueItemId, voteRepository.findByQueueItemId(queueItemId));
    }

    private void maybeAdjustThreshold(ModerationQueueItem item, FeedbackConsensus consensus, FeedbackSubmission submission) {
        if (item.isFeedbackAdjusted() || item.getRuleId() == null) {
            return;
        }
        if (consensus.getTotalVotes() < properties.getFeedback().getMinVotesForAdjustment()) {
            return;
        }
        SeverityRating direction = aggregator.adjustmentDirection(consensus);
        if (direction == null) {
            return;
        }

        Optional<Double> adjusted = ruleService.adjustThreshold(item.getRuleId(), direction);
        item.setFeedbackAdjusted(true);
        queueRepository.save(item);
        if (adjusted.isPresent()) {
            submission.setAdjustedRuleId(item.getRuleId());
            submission.setAdjustedThreshold(adjusted.get());
        }
    }

    private ModerationQueueItem findItem(Long queueItemId) {
        return queueRepository.findById(queueItemId)
                .orElseThrow(() -> new NotFoundException("Queue item not found: " + queueItemId));
    }
}
