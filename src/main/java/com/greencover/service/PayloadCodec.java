package com.greencover.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.greencover.exception.ErrorKind;
import com.greencover.exception.GreenCoverageException;
import com.greencover.model.result.CalculationPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * JSON encoding of cached payloads, applied only at the cache store boundary
 */
@Slf4j
@Component
public class PayloadCodec {

    private final ObjectMapper objectMapper;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(CalculationPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new GreenCoverageException(ErrorKind.UNEXPECTED,
                    "Cannot serialize " + payload.getClass().getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return empty when the text does not decode into {@code type}
     */
    public <T extends CalculationPayload> Optional<T> decode(String json, Class<T> type) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Cached payload is not a valid {}: {}", type.getSimpleName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
