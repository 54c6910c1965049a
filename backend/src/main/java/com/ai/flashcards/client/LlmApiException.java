package com.ai.flashcards.client;

import java.io.IOException;

/**
 * The AI provider answered, but with a non-success HTTP status.
 */
public class LlmApiException extends IOException {

    private final int statusCode;
    private final String responseBody;

    public LlmApiException(String provider, int statusCode, String responseBody) {
        super(provider + " API error [" + statusCode + "]: " + abbreviate(responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
