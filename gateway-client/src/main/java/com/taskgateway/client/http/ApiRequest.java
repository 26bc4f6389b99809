package com.taskgateway.client.http;

/**
 * One logical outbound call. The body is already serialized (JSON or a SOAP envelope).
 */
public record ApiRequest(
    String method,
    String path,
    String contentType,
    String body,
    String soapAction,
    String callClass
) {
    public static final String JSON = "application/json";
    public static final String SOAP_XML = "text/xml; charset=utf-8";

    public static ApiRequest json(String method, String path, String body, String callClass) {
        return new ApiRequest(method, path, JSON, body, null, callClass);
    }

    public static ApiRequest soap(String path, String envelope, String soapAction, String callClass) {
        return new ApiRequest("POST", path, SOAP_XML, envelope, soapAction, callClass);
    }
}
