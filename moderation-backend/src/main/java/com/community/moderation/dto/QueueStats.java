package com.community.moderation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    @JsonProperty("total_pending")
    private long totalPending;

    @JsonProperty("critical_items")
    private long criticalItems;

    @JsonProperty("auto_flagged")
    private long autoFlagged;
}
