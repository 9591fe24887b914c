package com.community.moderation.dto.analytics;

import com.community.moderation.model.ContentType;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ContentInsight {

    public static final String IMPACT_NEGATIVE = "negative";
    public static final String IMPACT_NEUTRAL = "neutral";

    private ContentType contentType;

    private String pattern;

    private int frequency;

    private String impact;

    private String recommendation;

    // 样例 contentId
    private List<String> examples = new ArrayList<>();
}
