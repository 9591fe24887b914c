package com.community.moderation.dto;

import com.community.moderation.model.TrustTier;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
public class ReputationDTO {

    private String userId;

    private int overallScore;

    private TrustTier trustTier;

    // 因子编码 -> 0..100
    private Map<String, Double> factors;

    private List<String> privileges;

    private int moderationStrikes;

    private LocalDateTime lastCalculated;

    // false 表示尚未建档，返回的是新用户默认值
    private boolean persisted;
}
