package com.community.moderation.rule;

import com.community.moderation.model.EvaluationContext;
import com.community.moderation.model.ReputationSnapshot;
import com.community.moderation.scoring.SignalScores;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 规则引擎的输入：信号 + 信誉 + 上下文，按路径寻址。
 * 未出现的 flags.* 路径视为 false，其它未知路径为 null（条件不满足）。
 */
public class SignalBundle {

    private static final String FLAG_PREFIX = "flags.";

    private final Map<String, Object> values;

    public SignalBundle(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static SignalBundle of(SignalScores scores, ReputationSnapshot reputation,
                                  EvaluationContext context, String content, long accountAgeDays) {
        Map<String, Object> values = new LinkedHashMap<>();

        // --- 1. 信号 ---
        values.put("signals.spam", scores.getSpam());
        values.put("signals.toxicity", scores.getToxicity());
        values.put("signals.quality", scores.getQuality());
        values.put("signals.culturalAdjustment", scores.getCulturalAdjustment());
        values.put("signals.maxRisk", scores.maxRisk());
        for (String flag : scores.getFlags()) {
            values.put(FLAG_PREFIX + flag, Boolean.TRUE);
        }

        // --- 2. 信誉 ---
        values.put("reputation.score", reputation.getOverallScore());
        values.put("reputation.tier", reputation.getTrustTier().getCode());
        values.put("reputation.tierRank", reputation.getTrustTier().ordinal());

        // --- 3. 上下文 ---
        if (context.getContextFlags() != null) {
            for (String flag : context.getContextFlags()) {
                values.put(FLAG_PREFIX + flag, Boolean.TRUE);
            }
        }
        values.put("context.contentType", context.getContentType().getCode());
        LocalDateTime submittedAt = context.getSubmittedAt();
        int hour = submittedAt.getHour();
        boolean weekend = submittedAt.getDayOfWeek() == DayOfWeek.SATURDAY
                || submittedAt.getDayOfWeek() == DayOfWeek.SUNDAY;
        values.put("context.hourOfDay", hour);
        values.put("context.isWeekend", weekend);
        values.put("context.isBusinessHours", !weekend && hour >= 9 && hour < 18);
        values.put("context.accountAgeDays", accountAgeDays);
        values.put("context.contentLength", content == null ? 0 : content.length());

        return new SignalBundle(values);
    }

    public Object resolve(String path) {
        Object value = values.get(path);
        if (value == null && path != null && path.startsWith(FLAG_PREFIX)) {
            return Boolean.FALSE;
        }
        return value;
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
