package com.irm.alert.service.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Encodes label and annotation maps to the JSON text kept in {@link AlertRecord}.
 */
@Component
@RequiredArgsConstructor
public class AlertPayloadSerializer {

    private static final TypeReference<Map<String, String>> MAP_STRING = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public String serialize(String fingerprint, Map<String, String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : Map.of());
        } catch (JsonProcessingException e) {
            throw new AlertSerializationException("Failed to serialize alert payload", fingerprint, e);
        }
    }

    public Map<String, String> deserialize(String fingerprint, String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_STRING);
        } catch (JsonProcessingException e) {
            throw new AlertSerializationException("Failed to deserialize alert payload", fingerprint, e);
        }
    }
}
