package com.whereq.forge.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.forge.exception.JobValidationException;
import com.whereq.forge.model.JobType;
import com.whereq.forge.model.payload.GenerationPayload;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Converts between the JSON form of a payload and its typed class
 */
@Component
public class PayloadCodec {

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Validator validator;

    /**
     * Decode and validate a submitted payload
     *
     * @throws JobValidationException if the payload does not fit {@code type}
     */
    public GenerationPayload bind(JobType type, JsonNode payload) {
        if (type == null) {
            throw new JobValidationException("type is required");
        }
        if (payload == null || !payload.isObject()) {
            throw new JobValidationException("payload must be a JSON object");
        }

        GenerationPayload decoded;
        try {
            decoded = decode(type, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new JobValidationException("Invalid " + type.getValue() + " payload: " + e.getMessage(), e);
        }

        Set<ConstraintViolation<GenerationPayload>> violations = validator.validate(decoded);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .toList();
            throw new JobValidationException(messages);
        }
        return decoded;
    }

    /**
     * Decode a payload that was validated at submission
     */
    public GenerationPayload read(JobType type, JsonNode payload) throws JsonProcessingException {
        return decode(type, payload);
    }

    public JsonNode toTree(GenerationPayload payload) {
        return objectMapper.valueToTree(payload);
    }

    private GenerationPayload decode(JobType type, JsonNode payload) throws JsonProcessingException {
        return objectMapper.treeToValue(payload, type.getPayloadClass());
    }
}
