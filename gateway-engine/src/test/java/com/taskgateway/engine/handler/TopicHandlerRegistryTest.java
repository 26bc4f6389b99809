package com.taskgateway.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TopicHandlerRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TopicHandler requiring(String... fields) {
        return new TopicHandler() {
            @Override
            public JsonNode handle(JsonNode payload) {
                return payload;
            }

            @Override
            public List<String> requiredFields() {
                return List.of(fields);
            }
        };
    }

    @Test
    void validate_shouldReportEveryMissingOrNullField() throws Exception {
        TopicHandlerRegistry registry = new TopicHandlerRegistry()
            .register("search", requiring("numero_processo", "tribunal", "cliente"));

        List<String> violations = registry.validate("search",
            objectMapper.readTree("{\"tribunal\":null,\"cliente\":\"ACME\"}"));

        assertThat(violations).containsExactly(
            "missing required field: numero_processo",
            "missing required field: tribunal");
    }

    @Test
    void validate_shouldRejectUnknownTopic() {
        TopicHandlerRegistry registry = new TopicHandlerRegistry();

        assertThat(registry.validate("nope", objectMapper.createObjectNode()))
            .containsExactly("unknown topic: nope");
    }

    @Test
    void validate_shouldAcceptCompletePayload() throws Exception {
        TopicHandlerRegistry registry = new TopicHandlerRegistry().register("search", requiring("id"));

        assertThat(registry.validate("search", objectMapper.readTree("{\"id\":0}"))).isEmpty();
        assertThat(registry.topics()).containsExactly("search");
        assertThat(registry.find("search")).isPresent();
    }
}
