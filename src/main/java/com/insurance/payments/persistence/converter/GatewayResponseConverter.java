package com.insurance.payments.persistence.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insurance.payments.domain.GatewayResponse;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link GatewayResponse} as JSON text.
 */
@Converter
public class GatewayResponseConverter implements AttributeConverter<GatewayResponse, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    public String convertToDatabaseColumn(GatewayResponse attribute) {
        if (attribute == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(attribute);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize gateway response", e);
        }
    }

    @Override
    public GatewayResponse convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(dbData, GatewayResponse.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to read stored gateway response", e);
        }
    }
}
