package io.feedloom.model;

public record DigestArtifact(
        String scopeKey,
        String text,
        long generatedAtMs,
        String sourceFingerprint,
        int articleCount
) {
}
