package com.taskgateway.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A variable in the workflow engine's typed form, serialized as {@code {"value": ..., "type": ...}}.
 */
public record TypedVariable(Object value, String type) {

    public static TypedVariable string(String value) {
        return new TypedVariable(value, "String");
    }

    /**
     * Infer the engine type from a JSON value. Objects and arrays travel as Json strings.
     */
    public static TypedVariable fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new TypedVariable(null, "Null");
        }
        if (node.isTextual()) {
            return new TypedVariable(node.asText(), "String");
        }
        if (node.isBoolean()) {
            return new TypedVariable(node.booleanValue(), "Boolean");
        }
        if (node.isInt()) {
            return new TypedVariable(node.intValue(), "Integer");
        }
        if (node.isIntegralNumber()) {
            return new TypedVariable(node.longValue(), "Long");
        }
        if (node.isNumber()) {
            return new TypedVariable(node.doubleValue(), "Double");
        }
        return new TypedVariable(node.toString(), "Json");
    }
}
