package com.taskgateway.engine.handler;

import java.util.List;

/**
 * How a topic maps onto one external API call.
 *
 * @param apiName     configured API the call goes to
 * @param accountId   account whose credential is used
 * @param method      HTTP method
 * @param path        path template; {@code {field}} segments are filled from the payload
 * @param callClass   call class selecting timeout and retry budget
 * @param contentType request content type; SOAP routes use {@code text/xml}
 * @param bodyField   payload field sent as the body, or null to send the whole payload
 * @param soapAction  SOAPAction header for SOAP routes
 * @param requiredFields payload fields required before submission
 */
public record TopicRoute(
    String apiName,
    String accountId,
    String method,
    String path,
    String callClass,
    String contentType,
    String bodyField,
    String soapAction,
    List<String> requiredFields
) {
    public TopicRoute {
        if (apiName == null || apiName.isBlank()) {
            throw new IllegalArgumentException("apiName is required");
        }
        if (path == null) {
            throw new IllegalArgumentException("path is required");
        }
        method = method != null ? method.toUpperCase() : "POST";
        requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
    }

    public boolean isSoap() {
        return contentType != null && contentType.toLowerCase().contains("xml");
    }
}
