package io.feedloom.model;

public record Article(
        String id,
        String feedId,
        String title,
        String link,
        String description,
        Long publishedAtMs,
        long fetchedAtMs,
        boolean read,
        boolean bookmarked,
        String insight,
        String insightLang,
        String translation,
        String translationLang,
        long updatedAtMs
) {
    public boolean hasInsight() {
        return insight != null && !insight.isBlank();
    }

    public boolean hasTranslation() {
        return translation != null && !translation.isBlank();
    }

    public long effectiveDateMs() {
        return publishedAtMs == null ? fetchedAtMs : publishedAtMs;
    }
}
