package com.community.moderation.scoring;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 打分服务返回的独立信号，所有分数范围 [0, 1]
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignalScores {

    public static final String FLAG_BILINGUAL = "bilingual";
    public static final String FLAG_REGIONAL_IDIOM = "regional_idiom";

    private double spam;
    private double toxicity;
    private double quality;
    // 文化语境衰减比例：0 表示不衰减
    private double culturalAdjustment;
    private Set<String> flags = new LinkedHashSet<>();

    public double maxRisk() {
        return Math.max(spam, toxicity);
    }

    public boolean hasFlag(String flag) {
        return flags != null && flags.contains(flag);
    }

    public Set<String> getFlags() {
        return flags == null ? Collections.emptySet() : flags;
    }

    public SignalScores clamped() {
        return new SignalScores(clamp(spam), clamp(toxicity), clamp(quality), clamp(culturalAdjustment),
                new LinkedHashSet<>(getFlags()));
    }

    /**
     * 双语或地域习语语境下，对 spam 与 toxicity 按 culturalAdjustment 做乘性衰减；
     * 衰减后分数不会超过原始分数
     */
    public SignalScores withCulturalAdjustment() {
        if (!hasFlag(FLAG_BILINGUAL) && !hasFlag(FLAG_REGIONAL_IDIOM)) {
            return this;
        }
        double factor = 1.0 - clamp(culturalAdjustment);
        return new SignalScores(Math.min(spam, spam * factor), Math.min(toxicity, toxicity * factor),
                quality, culturalAdjustment, new LinkedHashSet<>(getFlags()));
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
