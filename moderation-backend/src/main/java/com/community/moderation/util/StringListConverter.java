package com.community.moderation.util;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class StringListConverter extends JsonAttributeConverter<List<String>> {

    public StringListConverter() {
        super(new TypeReference<List<String>>() { });
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
