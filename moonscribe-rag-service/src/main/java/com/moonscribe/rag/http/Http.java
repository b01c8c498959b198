package com.moonscribe.rag.http;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Factory and helpers for the blocking JDK HttpClient shared by the provider adapters.
 * The client itself is created once by the configuration layer and injected.
 */
public final class Http {

    private Http() {}

    public static HttpClient newClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public static boolean isSuccess(HttpResponse<?> response) {
        return response.statusCode() / 100 == 2;
    }

    /**
     * Shortens an upstream response body for error messages.
     */
    public static String excerpt(String body, int max) {
        if (body == null) {
            return "";
        }
        String flat = body.replaceAll("\\s+", " ").trim();
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }
}
