package com.goormthonuniv.sentinel.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * 인용 출처 목록을 JSON 문자열 컬럼으로 저장한다. 순서 보존.
 */
@Converter
public class SourceRefListConverter implements AttributeConverter<List<SourceRef>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<SourceRef>> TYPE = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<SourceRef> attribute) {
        try {
            return MAPPER.writeValueAsString(attribute == null ? List.of() : attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize sources", e);
        }
    }

    @Override
    public List<SourceRef> convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) return List.of();
        try {
            return MAPPER.readValue(dbData, TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot deserialize sources", e);
        }
    }
}
