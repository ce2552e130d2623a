package com.pageanalytics.infrastructure.persistence.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

/**
 * Stores the distinct item ids of a summary row as a JSON array.
 */
@Converter
public class ItemIdsConverter implements AttributeConverter<List<Long>, String> {
    
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<Long>> ITEM_IDS = new TypeReference<>() {};
    
    @Override
    public String convertToDatabaseColumn(List<Long> itemIds) {
        if (itemIds == null || itemIds.isEmpty()) {
            return "[]";
        }
        try {
            return MAPPER.writeValueAsString(itemIds);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize item ids", e);
        }
    }
    
    @Override
    public List<Long> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return MAPPER.readValue(json, ITEM_IDS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt item ids column: " + json, e);
        }
    }
}
