package com.taskgateway.client.credential;

import com.taskgateway.client.ExternalApiException;
import com.taskgateway.core.model.CredentialRecord;

/**
 * Performs the credential-issuing call against an external API's authentication endpoint.
 */
@FunctionalInterface
public interface CredentialIssuer {

    CredentialRecord issue(String apiName, String accountId) throws ExternalApiException;
}
