package com.taskgateway.engine.correlation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class PayloadFingerprintTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PayloadFingerprint fingerprint = new PayloadFingerprint(objectMapper);

    @Test
    void hash_shouldIgnoreKeyOrderAtEveryLevel() throws Exception {
        String a = fingerprint.hash(objectMapper.readTree(
            "{\"b\":1,\"a\":{\"y\":[1,2],\"x\":\"v\"}}"), Set.of());
        String b = fingerprint.hash(objectMapper.readTree(
            "{\"a\":{\"x\":\"v\",\"y\":[1,2]},\"b\":1}"), Set.of());

        assertThat(a).isEqualTo(b).hasSize(64);
    }

    @Test
    void hash_shouldDropIgnoredTopLevelFields() throws Exception {
        String a = fingerprint.hash(objectMapper.readTree("{\"k\":\"1\",\"timestamp\":\"t1\"}"), Set.of("timestamp"));
        String b = fingerprint.hash(objectMapper.readTree("{\"k\":\"1\",\"timestamp\":\"t2\"}"), Set.of("timestamp"));
        String c = fingerprint.hash(objectMapper.readTree("{\"k\":\"1\",\"timestamp\":\"t2\"}"), Set.of());

        assertThat(a).isEqualTo(b);
        assertThat(c).isNotEqualTo(a);
    }

    @Test
    void hash_shouldKeepArrayOrderSignificant() throws Exception {
        String a = fingerprint.hash(objectMapper.readTree("{\"v\":[1,2]}"), Set.of());
        String b = fingerprint.hash(objectMapper.readTree("{\"v\":[2,1]}"), Set.of());

        assertThat(a).isNotEqualTo(b);
    }
}
