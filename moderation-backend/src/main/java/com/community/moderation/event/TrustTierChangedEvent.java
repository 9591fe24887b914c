package com.community.moderation.event;

import com.community.moderation.model.TrustTier;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户信任等级变化事件。等级决定发帖权限和是否可绕过人工队列。
 */
@Data
@AllArgsConstructor
public class TrustTierChangedEvent {

    private String userId;

    private TrustTier previousTier;

    private TrustTier newTier;

    private int overallScore;

    private LocalDateTime occurredAt;

    public boolean isPromotion() {
        return previousTier == null || newTier.ordinal() > previousTier.ordinal();
    }
}
