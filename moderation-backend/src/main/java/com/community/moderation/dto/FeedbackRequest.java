package com.community.moderation.dto;

import com.community.moderation.model.SeverityRating;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class FeedbackRequest {

    @NotNull(message = "queueItemId is required")
    private Long queueItemId;

    @NotNull(message = "wasAccurate is required")
    private Boolean wasAccurate;

    @NotNull(message = "severityRating is required")
    private SeverityRating severityRating;
}
