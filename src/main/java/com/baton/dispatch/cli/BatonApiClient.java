package com.baton.dispatch.cli;

import com.baton.core.config.BatonProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin JSON client for the Baton REST API, used by the CLI commands.
 */
@Component
public class BatonApiClient {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    public BatonApiClient(ObjectMapper objectMapper, BatonProperties properties) {
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(properties.getApi().getBaseUrl());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    public ApiResponse get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request);
    }

    public ApiResponse post(String path, Object body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();
        return send(request);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private ApiResponse send(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        String raw = response.body();
        JsonNode json = raw == null || raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);
        return new ApiResponse(response.statusCode(), json);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Status code plus parsed JSON body.
     */
    public record ApiResponse(int status, JsonNode body) {

        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }

        /** Error text from the body, with the broken rule when the server named one. */
        public String errorMessage() {
            String error = body.path("error").asText("HTTP " + status);
            String rule = body.path("rule").asText("");
            return rule.isEmpty() ? error : "[" + rule + "] " + error;
        }
    }
}
