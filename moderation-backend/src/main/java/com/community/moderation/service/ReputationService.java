package com.community.moderation.service;

import com.community.moderation.dto.ReputationDTO;
import com.community.moderation.entity.UserReputation;
import com.community.moderation.model.ReputationDelta;
import com.community.moderation.model.ReputationSnapshot;

public interface ReputationService {

    /**
     * 读取用户信誉快照（带缓存）。未建档用户返回 new 等级、100 分的默认值。
     */
    ReputationSnapshot getSnapshot(String userId);

    ReputationDTO getReputation(String userId);

    /**
     * 在调用方事务内应用增量；等级变化时发布 TrustTierChangedEvent
     */
    UserReputation applyDelta(String userId, ReputationDelta delta);

    void clearCache();
}
