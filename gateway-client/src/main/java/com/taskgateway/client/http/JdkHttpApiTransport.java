package com.taskgateway.client.http;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ApiTransport} on the JDK HTTP client.
 */
public class JdkHttpApiTransport implements ApiTransport {

    private final HttpClient httpClient;

    public JdkHttpApiTransport() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public JdkHttpApiTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ApiResponse send(ApiEndpoint endpoint, ApiRequest request, String bearerToken, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.BodyPublisher publisher = request.body() != null
            ? HttpRequest.BodyPublishers.ofString(request.body())
            : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(endpoint.resolve(request.path())))
            .timeout(timeout)
            .method(request.method(), publisher);

        if (request.contentType() != null) {
            builder.header("Content-Type", request.contentType());
        }
        if (bearerToken != null) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        if (request.soapAction() != null) {
            builder.header("SOAPAction", request.soapAction());
        }

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return new ApiResponse(response.statusCode(), response.body(), contentType);
    }
}
