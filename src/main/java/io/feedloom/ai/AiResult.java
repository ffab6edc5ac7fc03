package io.feedloom.ai;

public record AiResult(
        boolean success,
        String text,
        AiFailure failure
) {
    public static AiResult ok(String text) {
        return new AiResult(true, text, null);
    }

    public static AiResult fail(AiFailure.Kind kind, String message) {
        return new AiResult(false, null, new AiFailure(kind, message));
    }
}
