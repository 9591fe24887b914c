package com.community.moderation.service;

import com.community.moderation.dto.ReputationDTO;
import com.community.moderation.entity.UserReputation;
import com.community.moderation.event.TrustTierChangedEvent;
import com.community.moderation.model.ReputationDelta;
import com.community.moderation.model.ReputationFactor;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.TrustTier;
import com.community.moderation.repository.UserReputationRepository;
import com.community.moderation.util.AfterCommit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ReputationServiceImpl implements ReputationService {

    private static final Logger log = LoggerFactory.getLogger(ReputationServiceImpl.class);

    private final UserReputationRepository reputationRepository;
    private final ReputationAlgorithm reputationAlgorithm;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // 缓存：userId -> 信誉快照，写入后在事务提交时失效
    private final Map<String, ReputationSnapshot> snapshotCache = new ConcurrentHashMap<>();
    // 每次失效递增；加载期间发生过失效的快照不回填
    private final AtomicLong cacheGeneration = new AtomicLong();

    public ReputationServiceImpl(UserReputationRepository reputationRepository,
                                 ReputationAlgorithm reputationAlgorithm,
                                 ApplicationEventPublisher eventPublisher,
                                 Clock clock) {
        this.reputationRepository = reputationRepository;
        this.reputationAlgorithm = reputationAlgorithm;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    public ReputationSnapshot getSnapshot(String userId) {
        ReputationSnapshot cached = snapshotCache.get(userId);
        if (cached != null) {
            return cached;
        }
        long generation = cacheGeneration.get();
        ReputationSnapshot snapshot = reputationRepository.findById(userId)
                .map(this::toSnapshot)
                .orElseGet(() -> new ReputationSnapshot(userId, defaultReputation(userId).getOverallScore(),
                        TrustTier.NEW, null));
        snapshotCache.compute(userId,
                (key, existing) -> cacheGeneration.get() == generation ? snapshot : existing);
        return snapshot;
    }

    @Override
    @Transactional(readOnly = true)
    public ReputationDTO getReputation(String userId) {
        Optional<UserReputation> stored = reputationRepository.findById(userId);
        UserReputation reputation = stored.orElseGet(() -> defaultReputation(userId));

        Map<String, Double> factors = new LinkedHashMap<>();
        for (ReputationFactor factor : ReputationFactor.values()) {
            factors.put(factor.getCode(), reputationAlgorithm.getFactor(reputation, factor));
        }

        ReputationDTO dto = new ReputationDTO();
        dto.setUserId(userId);
        dto.setOverallScore(reputation.getOverallScore());
        dto.setTrustTier(reputation.getTrustTier());
        dto.setFactors(factors);
        dto.setPrivileges(reputation.getTrustTier().getPrivileges());
        dto.setModerationStrikes(reputation.getModerationStrikes());
        dto.setLastCalculated(reputation.getLastCalculated());
        dto.setPersisted(stored.isPresent());
        return dto;
    }

    @Override
    @Transactional
    public UserReputation applyDelta(String userId, ReputationDelta delta) {
        LocalDateTime now = LocalDateTime.now(clock);
        UserReputation reputation = reputationRepository.findById(userId)
                .orElseGet(() -> reputationAlgorithm.newBaseline(userId, now));
        TrustTier previousTier = reputation.getTrustTier();
        int previousScore = reputation.getOverallScore();

        reputationAlgorithm.apply(reputation, delta, now);
        UserReputation saved = reputationRepository.save(reputation);
        log.debug("用户 {} 信誉更新 ({}): {} -> {}", userId, delta.getReason(), previousScore, saved.getOverallScore());

        if (previousTier != saved.getTrustTier()) {
            eventPublisher.publishEvent(new TrustTierChangedEvent(userId, previousTier, saved.getTrustTier(),
                    saved.getOverallScore(), now));
        }
        evictAfterCommit(userId);
        return saved;
    }

    @Override
    public void clearCache() {
        int size = snapshotCache.size();
        cacheGeneration.incrementAndGet();
        snapshotCache.clear();
        log.info("信誉缓存已清空，共移除 {} 条。", size);
    }

    private void evictAfterCommit(String userId) {
        AfterCommit.run(() -> {
            cacheGeneration.incrementAndGet();
            snapshotCache.remove(userId);
        });
    }

    private UserReputation defaultReputation(String userId) {
        return reputationAlgorithm.newBaseline(userId, LocalDateTime.now(clock));
    }

    private ReputationSnapshot toSnapshot(UserReputation reputation) {
        return new ReputationSnapshot(reputation.getUserId(), reputation.getOverallScore(),
                reputation.getTrustTier(), reputation.getCreatedAt());
    }
}
