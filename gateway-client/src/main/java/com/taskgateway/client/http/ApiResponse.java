package com.taskgateway.client.http;

/**
 * Raw response of an external API.
 */
public record ApiResponse(int statusCode, String body, String contentType) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isJson() {
        return contentType != null && contentType.toLowerCase().contains("json");
    }
}
