package com.community.moderation.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;

/**
 * 将集合类字段以 JSON 文本形式存入单列
 *
 * @param <T> 字段类型
 */
public abstract class JsonAttributeConverter<T> implements AttributeConverter<T, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TypeReference<T> typeReference;

    protected JsonAttributeConverter(TypeReference<T> typeReference) {
        this.typeReference = typeReference;
    }

    protected abstract T emptyValue();

    @Override
    public String convertToDatabaseColumn(T attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? emptyValue() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("无法序列化 JSON 列", e);
        }
    }

    @Override
    public T convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return emptyValue();
        }
        try {
            return MAPPER.readValue(dbData, typeReference);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("无法解析 JSON 列: " + dbData, e);
        }
    }
}
