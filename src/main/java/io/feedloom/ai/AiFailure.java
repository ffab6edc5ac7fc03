package io.feedloom.ai;

public record AiFailure(Kind kind, String message) {
    public enum Kind {
        TRANSIENT,
        TIMEOUT,
        UNAVAILABLE,
        MISSING_CREDENTIALS,
        REJECTED,
        CANCELED
    }
}
