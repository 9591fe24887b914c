package com.community.moderation.scoring;

import com.community.moderation.model.ContentType;

/**
 * 外部打分能力：把文本转换为数值风险信号。实现可以是本地启发式，也可以是远程模型服务。
 */
public interface SignalScorer {

    SignalScores score(String content, ContentType contentType);
}
