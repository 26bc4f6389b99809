package com.taskgateway.api.rest;

import com.taskgateway.client.credential.CredentialCache;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operator controls for cached credentials.
 */
@RestController
@RequestMapping("/api/v1/credentials")
public class CredentialController {

    private final CredentialCache credentialCache;

    public CredentialController(CredentialCache credentialCache) {
        this.credentialCache = credentialCache;
    }

    /**
     * Drop the credential of one account; the next call authenticates again.
     */
    @DeleteMapping("/{apiName}/{accountId}")
    public ResponseEntity<Void> invalidate(@PathVariable String apiName, @PathVariable String accountId) {
        credentialCache.invalidate(apiName, accountId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Drop every credential of an API, e.g. after a password rotation.
     */
    @DeleteMapping("/{apiName}")
    public ResponseEntity<Map<String, Object>> invalidateAll(@PathVariable String apiName) {
        int removed = credentialCache.invalidateAll(apiName);
        return ResponseEntity.ok(Map.of("apiName", apiName, "invalidated", removed));
    }
}
