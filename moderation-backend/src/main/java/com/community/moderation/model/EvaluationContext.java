package com.community.moderation.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 评估上下文：内容类型、提交时间和调用方附带的上下文标记（如 professional_context）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationContext {

    private ContentType contentType;

    private LocalDateTime submittedAt;

    private Set<String> contextFlags = new LinkedHashSet<>();
}
