package com.community.moderation.dto;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.DecisionAction;
import com.community.moderation.model.Severity;
import com.community.moderation.model.TrustTier;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 一次评估的结果（只读）
 */
@Data
public class ModerationResult {

    private String evaluationId;

    private String contentId;

    private ContentType contentType;

    private String authorId;

    // 打分服务返回的原始信号
    private SignalScoresDTO scores;

    // 文化语境衰减后参与决策的信号
    private SignalScoresDTO adjustedScores;

    private List<String> flags = new ArrayList<>();

    private boolean shouldFlag;

    private Severity severity;

    private DecisionAction action;

    private double confidence;

    private List<String> ruleIdsTriggered = new ArrayList<>();

    private String winningRuleId;

    // 胜出规则附带的副作用：warn / notify / escalate
    private List<String> sideEffects = new ArrayList<>();

    private String reason;

    private TrustTier authorTier;

    private int authorScore;

    private Long queueItemId;

    private boolean queueBypassed;

    private boolean degraded;

    private long processingTimeMs;

    private LocalDateTime computedAt;
}
