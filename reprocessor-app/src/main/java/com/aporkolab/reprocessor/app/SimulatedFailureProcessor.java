package com.aporkolab.reprocessor.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.aporkolab.reprocessor.exception.ProcessingFailureException;
import com.aporkolab.reprocessor.flow.MessageProcessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Sample processing operation used to exercise retry and DLQ routing.
 * 
 * Payloads are JSON. A payload carrying
 * {@code "simulateError": {"namespace": "HTTP", "type": "SERVICE_UNAVAILABLE"}}
 * fails with that error every time it is processed; anything else succeeds.
 * Payloads that are not JSON fail with KAFKA:DESERIALIZATION.
 */
@Component
public class SimulatedFailureProcessor implements MessageProcessor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedFailureProcessor.class);

    private final ObjectMapper objectMapper;

    public SimulatedFailureProcessor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void process(String key, String payload) {
        JsonNode message = parse(payload);

        JsonNode simulated = message.path("simulateError");
        if (simulated.isObject()) {
            String namespace = simulated.path("namespace").asText("HTTP");
            String type = simulated.path("type").asText("INTERNAL_SERVER_ERROR");
            String description = simulated.path("description").asText("Simulated " + namespace + " failure");
            throw new ProcessingFailureException(namespace, type, description, message);
        }

        log.info("Processed message key={}", key);
    }

    private JsonNode parse(String payload) {
        if (payload == null || payload.isBlank()) {
            throw ProcessingFailureException.kafka("EMPTY_PAYLOAD", "Message has no payload", null);
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new ProcessingFailureException("KAFKA", "DESERIALIZATION",
                    "Payload is not valid JSON: " + e.getOriginalMessage(), payload, e);
        }
    }
}
