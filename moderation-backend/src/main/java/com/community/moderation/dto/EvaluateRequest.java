package com.community.moderation.dto;

import com.community.moderation.model.ContentType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
public class EvaluateRequest {

    @NotBlank(message = "Content is required")
    @Size(max = 20000, message = "Content must be at most 20000 characters")
    private String content;

    @NotNull(message = "Content type is required")
    private ContentType contentType;

    @NotBlank(message = "Content ID is required")
    @Size(max = 64)
    private String contentId;

    // true 时只返回结果，不落库也不入队
    private boolean analyzeOnly;

    // 调用方附带的上下文标记，例如 professional_context
    private Set<String> contextFlags = new LinkedHashSet<>();
}
