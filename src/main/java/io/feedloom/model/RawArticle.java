package io.feedloom.model;

/**
 * One entry as handed over by the feed fetcher, before an id is derived.
 */
public record RawArticle(
        String title,
        String link,
        String description,
        Long publishedAtMs
) {
}
