package com.community.moderation.service;

import com.community.moderation.dto.EvaluateRequest;
import com.community.moderation.dto.ModerationResult;
import com.community.moderation.entity.ModerationDecision;

import java.util.List;

public interface ContentModerationService {

    /**
     * 评估内容。打分服务不可用时返回降级的 review 结果，不会回落为 allow。
     */
    ModerationResult evaluate(EvaluateRequest request, String authorId);

    /**
     * 内容的评估历史，最新在前
     */
    List<ModerationDecision> history(String contentId);
}
