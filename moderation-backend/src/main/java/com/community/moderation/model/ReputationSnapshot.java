package com.community.moderation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 评估时读取的作者信誉快照（只读）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReputationSnapshot {

    private String userId;

    private int overallScore;

    private TrustTier trustTier;

    // 首次建立信誉记录的时间，用于计算账号年龄；未建档用户为 null
    private LocalDateTime firstSeenAt;
}
