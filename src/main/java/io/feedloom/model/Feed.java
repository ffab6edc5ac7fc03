package io.feedloom.model;

public record Feed(
        String id,
        String url,
        String name,
        Long lastFetchedAtMs
) {
}
