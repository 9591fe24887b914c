package com.community.moderation.dto;

import com.community.moderation.model.ContentType;
import com.community.moderation.model.ReportCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ReportRequest {

    @NotNull(message = "Content type is required")
    private ContentType contentType;

    @NotBlank(message = "Content ID is required")
    @Size(max = 64)
    private String contentId;

    @NotNull(message = "Category is required")
    private ReportCategory category;

    @NotBlank(message = "Reason is required")
    @Size(max = 500, message = "Reason must be at most 500 characters")
    private String reason;

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @Size(max = 10, message = "At most 10 evidence URLs are allowed")
    private List<String> evidenceUrls = new ArrayList<>();

    // 可选：被举报内容的作者；缺省时取该内容最近一次审核记录中的作者
    @Size(max = 64)
    private String authorId;
}
