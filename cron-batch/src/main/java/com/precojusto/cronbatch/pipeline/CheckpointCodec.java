package com.precojusto.cronbatch.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.precojusto.cronbatch.exception.NonRetryableStepException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of step outputs and item payloads.
 */
@Component
@RequiredArgsConstructor
public class CheckpointCodec {

    private final ObjectMapper objectMapper;

    public String encode(Object value, String what) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new NonRetryableStepException("Failed to serialize " + what + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode stored JSON. Unreadable data fails the item.
     */
    public <T> T decode(String json, Class<T> type, String what) {
        if (json == null || json.isBlank()) {
            throw new NonRetryableStepException("No data stored for " + what);
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new NonRetryableStepException("Failed to decode " + what + ": " + e.getOriginalMessage(), e);
        }
    }
}
