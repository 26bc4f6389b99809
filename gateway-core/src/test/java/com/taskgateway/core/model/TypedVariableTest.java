package com.taskgateway.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class TypedVariableTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void fromJson_shouldInferEngineTypes() throws Exception {
        var node = mapper.readTree("""
            {"s": "A", "b": true, "i": 7, "l": 9999999999, "d": 1.5, "o": {"k": 1}, "n": null}
            """);
        
        assertEquals(new TypedVariable("A", "String"), TypedVariable.fromJson(node.get("s")));
        assertEquals(new TypedVariable(true, "Boolean"), TypedVariable.fromJson(node.get("b")));
        assertEquals(new TypedVariable(7, "Integer"), TypedVariable.fromJson(node.get("i")));
        assertEquals(new TypedVariable(9999999999L, "Long"), TypedVariable.fromJson(node.get("l")));
        assertEquals(new TypedVariable(1.5, "Double"), TypedVariable.fromJson(node.get("d")));
        assertEquals(new TypedVariable("{\"k\":1}", "Json"), TypedVariable.fromJson(node.get("o")));
        assertEquals("Null", TypedVariable.fromJson(node.get("n")).type());
        assertEquals("Null", TypedVariable.fromJson(node.path("absent")).type());
    }
}
