package com.taskgateway.engine.correlation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Set;

/**
 * SHA-256 of a payload in canonical form: keys sorted at every level, ignored top-level fields removed.
 * Two deliveries of the same notification hash equally regardless of key order.
 */
public class PayloadFingerprint {

    private final ObjectMapper canonicalMapper;

    public PayloadFingerprint(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    public String hash(JsonNode payload, Set<String> ignoredFields) {
        JsonNode subject = payload;
        if (payload.isObject() && !ignoredFields.isEmpty()) {
            ObjectNode copy = payload.deepCopy();
            copy.remove(ignoredFields);
            subject = copy;
        }
        try {
            Object plain = canonicalMapper.treeToValue(subject, Object.class);
            byte[] canonical = canonicalMapper.writeValueAsString(plain).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload cannot be canonicalized", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
