package com.community.moderation.dto;

import com.community.moderation.scoring.SignalScores;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalScoresDTO {

    private double spam;

    private double toxicity;

    private double quality;

    private double culturalAdjustment;

    public static SignalScoresDTO from(SignalScores scores) {
        return new SignalScoresDTO(scores.getSpam(), scores.getToxicity(), scores.getQuality(),
                scores.getCulturalAdjustment());
    }
}
