package com.community.moderation.util;

import com.community.moderation.rule.RuleCondition;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class RuleConditionsConverter extends JsonAttributeConverter<List<RuleCondition>> {

    public RuleConditionsConverter() {
        super(new TypeReference<List<RuleCondition>>() { });
    }

    @Override
    protected List<RuleCondition> emptyValue() {
        return new ArrayList<>();
    }
}
