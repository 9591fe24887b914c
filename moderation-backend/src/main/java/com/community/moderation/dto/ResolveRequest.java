package com.community.moderation.dto;

import com.community.moderation.model.ResolutionAction;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ResolveRequest {

    @NotNull(message = "queueItemId is required")
    private Long queueItemId;

    @NotNull(message = "action is required")
    private ResolutionAction action;

    @Size(max = 2000, message = "moderatorNotes must be at most 2000 characters")
    private String moderatorNotes;
}
