package com.community.moderation.service;

import com.community.moderation.dto.ReputationDTO;
import com.community.moderation.entity.UserReputation;
import com.community.moderation.event.TrustTierChangedEvent;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.model.ResolutionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import com.community.moderation.repository.UserReputationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReputationServiceImplTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 2, 18, 0);

    @Mock
    private UserReputationRepository reputationRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private ReputationAlgorithm algorithm;
    private ReputationServiceImpl reputationService;

    @BeforeEach
    void setUp() {
        algorithm = new ReputationAlgorithm();
        Clock clock = Clock.fixed(Instant.parse("2025-03-02T18:00:00Z"), ZoneOffset.UTC);
        reputationService = new ReputationServiceImpl(reputationRepository, algorithm, eventPublisher, clock);
    }

    // 未建档用户按新用户默认值处理，并缓存快照
    @Test
    void testGetSnapshot_UnknownUserDefaultsAndCaches() {
        when(reputationRepository.findById("ghost")).thenReturn(Optional.empty());

        ReputationSnapshot first = reputationService.getSnapshot("ghost");
        ReputationSnapshot second = reputationService.getSnapshot("ghost");

        assertEquals(100, first.getOverallScore());
        assertEquals(TrustTier.NEW, first.getTrustTier());
        assertNull(first.getFirstSeenAt());
        assertEquals(first, second);
        verify(reputationRepository, times(1)).findById("ghost");
    }

    @Test
    void testGetReputation_UnknownUser() {
        when(reputationRepository.findById("ghost")).thenReturn(Optional.empty());

        ReputationDTO dto = reputationService.getReputation("ghost");

        assertFalse(dto.isPersisted());
        assertEquals(100, dto.getOverallScore());
        assertEquals(8, dto.getFactors().size());
        assertEquals(10.0, dto.getFactors().get("moderationHistory"));
        assertEquals(TrustTier.NEW.getPrivileges(), dto.getPrivileges());
    }

    @Test
    void testApplyDelta_NewUserGetsBaseline() {
        when(reputationRepository.findById("u1")).thenReturn(Optional.empty());
        when(reputationRepository.save(any(UserReputation.class))).thenAnswer(inv -> inv.getArgument(0));

        UserReputation saved = reputationService.applyDelta("u1", algorithm.accurateVoteReward());

        assertEquals(101, saved.getOverallScore());
        assertEquals(NOW, saved.getCreatedAt());
        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    // 跌破等级分界时发布等级变化事件
    @Test
    void testApplyDelta_TierChangePublishesEvent() {
        UserReputation trusted = reputationWithAllFactors("u2", 15.0);
        assertEquals(TrustTier.TRUSTED, trusted.getTrustTier());
        when(reputationRepository.findById("u2")).thenReturn(Optional.of(trusted));
        when(reputationRepository.save(any(UserReputation.class))).thenAnswer(inv -> inv.getArgument(0));

        UserReputation saved = reputationService.applyDelta("u2",
                algorithm.resolutionDelta(ResolutionAction.REJECT, Severity.HIGH));

        assertEquals(139, saved.getOverallScore());
        ArgumentCaptor<TrustTierChangedEvent> captor = ArgumentCaptor.forClass(TrustTierChangedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(TrustTier.TRUSTED, captor.getValue().getPreviousTier());
        assertEquals(TrustTier.NEW, captor.getValue().getNewTier());
        assertFalse(captor.getValue().isPromotion());
    }

    // 写入后缓存失效，下一次读取看到新分数
    @Test
    void testApplyDelta_EvictsCachedSnapshot() {
        UserReputation stored = algorithm.newBaseline("u3", NOW.minusDays(30));
        when(reputationRepository.findById("u3")).thenReturn(Optional.of(stored));
        when(reputationRepository.save(any(UserReputation.class))).thenAnswer(inv -> inv.getArgument(0));

        assertEquals(100, reputationService.getSnapshot("u3").getOverallScore());
        reputationService.applyDelta("u3", algorithm.reporterReward());
        ReputationSnapshot refreshed = reputationService.getSnapshot("u3");

        assertEquals(101, refreshed.getOverallScore());
        assertEquals(NOW.minusDays(30), refreshed.getFirstSeenAt());
        assertTrue(stored.getLastCalculated().isEqual(NOW));
    }

    // 读取数据库与回填缓存之间发生写入：旧快照不会留在缓存里
    @Test
    void testGetSnapshot_StaleLoadNotCachedAfterConcurrentEviction() {
        UserReputation stale = algorithm.newBaseline("u4", NOW.minusDays(30));
        UserReputation fresh = algorithm.newBaseline("u4", NOW.minusDays(30));
        AtomicInteger calls = new AtomicInteger();
        when(reputationRepository.findById("u4")).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 1) {
                // 首次读取拿到旧数据后，另一笔写入先提交并失效缓存
                reputationService.applyDelta("u4", algorithm.reporterReward());
                return Optional.of(stale);
            }
            return Optional.of(fresh);
        });
        when(reputationRepository.save(any(UserReputation.class))).thenAnswer(inv -> inv.getArgument(0));

        ReputationSnapshot first = reputationService.getSnapshot("u4");
        ReputationSnapshot second = reputationService.getSnapshot("u4");
        ReputationSnapshot third = reputationService.getSnapshot("u4");

        assertEquals(100, first.getOverallScore());
        assertEquals(101, second.getOverallScore());
        assertEquals(101, third.getOverallScore());
        // 第二次读取重新加载后回填，第三次命中缓存
        verify(reputationRepository, times(3)).findById("u4");
    }

    // 清空缓存后重新读取
    @Test
    void testClearCache_ReloadsSnapshot() {
        when(reputationRepository.findById("ghost")).thenReturn(Optional.empty());

        reputationService.getSnapshot("ghost");
        reputationService.clearCache();
        reputationService.getSnapshot("ghost");

        verify(reputationRepository, times(2)).findById("ghost");
    }

    private UserReputation reputationWithAllFactors(String userId, double value) {
        UserReputation reputation = new UserReputation();
        reputation.setUserId(userId);
        reputation.setContentQuality(value);
        reputation.setCommunityHelpfulness(value);
        reputation.setConsistentActivity(value);
        reputation.setModerationHistory(value);
        reputation.setExpertise(value);
        reputation.setCommunityTrust(value);
        reputation.setAccountMaturity(value);
        reputation.setBehaviorPattern(value);
        reputation.setOverallScore(algorithm.calculateOverallScore(reputation));
        reputation.setTrustTier(algorithm.determineTrustTier(reputation.getOverallScore()));
        return reputation;
    }
}
