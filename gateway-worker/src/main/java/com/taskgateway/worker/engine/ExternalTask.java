package com.taskgateway.worker.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;

/**
 * A locked external task as returned by the engine's fetch-and-lock call.
 * Variables keep the engine's typed form: {@code {"name": {"value": ..., "type": ...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExternalTask(
    String id,
    String topicName,
    String workerId,
    String processInstanceId,
    String businessKey,
    Integer retries,
    JsonNode variables
) {
    /**
     * Value of a variable, or a missing node when the variable is absent.
     */
    public JsonNode variable(String name) {
        if (variables == null) {
            return JsonNodeFactory.instance.missingNode();
        }
        JsonNode typed = variables.get(name);
        return typed == null ? JsonNodeFactory.instance.missingNode() : typed.path("value");
    }

    public boolean hasVariable(String name) {
        JsonNode value = variable(name);
        return !value.isMissingNode() && !value.isNull()
            && !(value.isTextual() && value.asText().isBlank());
    }

    /**
     * Plain {@code name -> value} document of all variables.
     */
    public ObjectNode variablesAsDocument() {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        if (variables == null) {
            return document;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = variables.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            document.set(field.getKey(), field.getValue().path("value"));
        }
        return document;
    }
}
