package com.taskgateway.engine.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps topic names to their handlers.
 */
public class TopicHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(TopicHandlerRegistry.class);

    private final Map<String, TopicHandler> handlers = new ConcurrentHashMap<>();

    public TopicHandlerRegistry register(String topic, TopicHandler handler) {
        TopicHandler previous = handlers.put(topic, handler);
        if (previous != null) {
            log.warn("Replaced handler for topic {}", topic);
        } else {
            log.info("Registered handler for topic {}", topic);
        }
        return this;
    }

    public Optional<TopicHandler> find(String topic) {
        return Optional.ofNullable(handlers.get(topic));
    }

    public Set<String> topics() {
        return new TreeSet<>(handlers.keySet());
    }

    /**
     * List the problems that prevent a payload from being accepted for a topic.
     *
     * @return violations, empty if the submission is valid
     */
    public List<String> validate(String topic, JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (topic == null || topic.isBlank()) {
            violations.add("topic is required");
            return violations;
        }
        TopicHandler handler = handlers.get(topic);
        if (handler == null) {
            violations.add("unknown topic: " + topic);
            return violations;
        }
        for (String field : handler.requiredFields()) {
            if (payload == null || !payload.hasNonNull(field)) {
                violations.add("missing required field: " + field);
            }
        }
        return violations;
    }
}
