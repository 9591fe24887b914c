package com.community.moderation.util;

import com.community.moderation.rule.RuleAction;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class RuleActionsConverter extends JsonAttributeConverter<List<RuleAction>> {

    public RuleActionsConverter() {
        super(new TypeReference<List<RuleAction>>() { });
    }

    @Override
    protected List<RuleAction> emptyValue() {
        return new ArrayList<>();
    }
}
