package com.community.moderation.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class RuleActivationRequest {

    @NotNull(message = "active is required")
    private Boolean active;
}
