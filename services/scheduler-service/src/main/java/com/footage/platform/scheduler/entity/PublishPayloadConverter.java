package com.footage.platform.scheduler.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.footage.platform.scheduler.dto.PublishPayload;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores the enrichment payload as a JSON text column.
 */
@Converter
public class PublishPayloadConverter implements AttributeConverter<PublishPayload, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String convertToDatabaseColumn(PublishPayload payload) {
        if (payload == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize publish payload", e);
        }
    }

    @Override
    public PublishPayload convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, PublishPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not read publish payload", e);
        }
    }
}
