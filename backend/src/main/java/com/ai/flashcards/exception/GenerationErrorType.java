package com.ai.flashcards.exception;

/**
 * Classification of AI generation failures. Only the retryable classes are
 * attempted again.
 */
public enum GenerationErrorType {
    RATE_LIMIT("rate_limit", true),
    SERVER_ERROR("server_error", true),
    NETWORK_ERROR("network_error", true),
    QUOTA_EXCEEDED("quota_exceeded", false),
    INVALID_RESPONSE("invalid_response", false),
    CLIENT_ERROR("client_error", false);

    private final String code;
    private final boolean retryable;

    GenerationErrorType(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Maps an HTTP status from the AI provider to an error class. Providers report
     * exhausted billing either as 402 or as a 429 whose body mentions the quota.
     */
    public static GenerationErrorType fromStatus(int status, String body) {
        if (status == 402) {
            return QUOTA_EXCEEDED;
        }
        if (status == 429) {
            String lower = body == null ? "" : body.toLowerCase();
            return lower.contains("insufficient_quota") || lower.contains("quota exceeded")
                    ? QUOTA_EXCEEDED
                    : RATE_LIMIT;
        }
        if (status >= 500) {
            return SERVER_ERROR;
        }
        return CLIENT_ERROR;
    }
}
