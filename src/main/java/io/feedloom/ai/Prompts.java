package io.feedloom.ai;

import io.feedloom.model.Article;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prompt templates. Templates are written in English; the answer language is injected by name.
 */
public final class Prompts {
    public static final Map<String, String> LANGUAGE_NAMES;
    public static final Set<String> TRANSLATABLE_LANGUAGES = Set.of("ko", "ja", "zh-CN", "es", "de");
    public static final String TITLE_KEY = "Title:";
    public static final String DESCRIPTION_KEY = "Description:";
    static final String NONE_TEXT = "(none)";
    static final int MAX_DESCRIPTION_CHARS = 2_000;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    static {
        Map<String, String> names = new LinkedHashMap<>();
        names.put("en", "English");
        names.put("ko", "Korean");
        names.put("ja", "Japanese");
        names.put("zh-CN", "Simplified Chinese");
        names.put("es", "Spanish");
        names.put("de", "German");
        LANGUAGE_NAMES = Map.copyOf(names);
    }

    private static final String INSIGHT = """
            You are an intelligent reader analyzing an article. \
            Based on the title and description below, provide a sharp, opinionated insight in 1-2 sentences. \
            Focus on WHY this matters: its practical impact, hidden implications, or what readers should watch out for. \
            Do NOT simply restate the title or summarize. Instead, add your own analytical perspective. \
            Keep technical terms as-is. \
            Respond in %s.

            <article>
            <title>%s</title>
            <description>%s</description>
            </article>""";

    private static final String INSIGHT_PERSONA = """
            You are an intelligent reader providing personalized insights.

            <reader_profile>
            %s
            </reader_profile>

            Based on the reader's background, analyze the article below and provide a sharp, \
            relevant insight in 1-2 sentences. Focus on what specifically matters to THIS reader: \
            practical implications for their role, opportunities they should notice, risks to watch out for, \
            or connections to their domain.
            Do NOT simply restate the title or summarize. Add analytical perspective tailored to the reader's context. \
            Keep technical terms as-is. \
            Respond in %s.

            <article>
            <title>%s</title>
            <description>%s</description>
            </article>""";

    private static final String TRANSLATE_META = """
            Translate the title and description of the English article below into natural %s. \
            For technical terms, include the English in parentheses. \
            Output only in the following format:
            Title: (translated title)
            Description: (translated description)

            <article>
            <title>%s</title>
            <description>%s</description>
            </article>""";

    private static final String BOOKMARK_ANALYSIS = """
            Below are articles I bookmarked.
            %s
            <bookmarks>
            %s
            </bookmarks>

            Please analyze the following and respond in %s:
            1. Common themes and topics across these bookmarks
            2. Key insights and takeaways
            3. Suggested areas to explore further""";

    private static final String RECENT_DIGEST = """
            Below are the articles from the last %d day(s).

            <articles>
            %s
            </articles>

            Write a digest of this period and respond in %s:
            1. The main stories and how they relate to each other
            2. Notable trends worth following
            3. The few articles most worth reading in full, and why""";

    private static final String BOOKMARK_ITEM = "- Title: %s\n  Description: %s\n  Insight: %s";
    private static final String ARTICLE_ITEM = "- [%s] %s\n  Description: %s\n  Insight: %s";

    private Prompts() {
    }

    public static String languageName(String code) {
        return LANGUAGE_NAMES.getOrDefault(code, code);
    }

    public static boolean isTranslatable(String code) {
        return TRANSLATABLE_LANGUAGES.contains(code);
    }

    public static String insight(Article article, String language, String persona) {
        String description = orNone(article.description());
        if (persona == null || persona.isBlank()) {
            return String.format(INSIGHT, languageName(language), article.title(), description);
        }
        return String.format(INSIGHT_PERSONA, persona.strip(), languageName(language), article.title(), description);
    }

    public static String translation(Article article, String language) {
        return String.format(TRANSLATE_META, languageName(language), article.title(), orNone(article.description()));
    }

    public static String bookmarkDigest(List<Article> articles, String language, String persona) {
        StringBuilder items = new StringBuilder();
        for (Article a : articles) {
            if (items.length() > 0) {
                items.append('\n');
            }
            items.append(String.format(BOOKMARK_ITEM, a.title(), orNone(a.description()), orNone(a.insight())));
        }
        String profile = persona == null || persona.isBlank()
                ? ""
                : "\n<reader_profile>\n" + persona.strip() + "\n</reader_profile>\n";
        return String.format(BOOKMARK_ANALYSIS, profile, items, languageName(language));
    }

    public static String recentDigest(List<Article> articles, int days, String language) {
        StringBuilder items = new StringBuilder();
        for (Article a : articles) {
            if (items.length() > 0) {
                items.append('\n');
            }
            String date = DAY.format(Instant.ofEpochMilli(a.effectiveDateMs()));
            items.append(String.format(ARTICLE_ITEM, date, a.title(), orNone(a.description()), orNone(a.insight())));
        }
        return String.format(RECENT_DIGEST, days, items, languageName(language));
    }

    /**
     * Splits a translation answer into title and description. Without a {@code Title:} line the
     * first line is taken as the title, and the original title is the last resort.
     */
    public static Translation parseTranslation(String output, String fallbackTitle) {
        String title = "";
        String description = "";
        String raw = output == null ? "" : output;
        String[] lines = raw.split("\n");
        for (String line : lines) {
            String trimmed = line.strip();
            if (trimmed.startsWith(TITLE_KEY)) {
                title = trimmed.substring(TITLE_KEY.length()).strip();
            } else if (trimmed.startsWith(DESCRIPTION_KEY)) {
                description = trimmed.substring(DESCRIPTION_KEY.length()).strip();
            }
        }
        if (title.isEmpty()) {
            String first = lines.length == 0 ? "" : lines[0].strip();
            if (first.isEmpty() || first.equals(TITLE_KEY) || first.equals("Title")) {
                title = fallbackTitle;
            } else {
                title = first;
            }
        }
        return new Translation(title, description);
    }

    private static String orNone(String value) {
        if (value == null || value.isBlank()) {
            return NONE_TEXT;
        }
        String v = value.strip();
        return v.length() > MAX_DESCRIPTION_CHARS ? v.substring(0, MAX_DESCRIPTION_CHARS) : v;
    }

    public record Translation(String title, String description) {
        /**
         * Stored form: the title, a blank line, then the description when there is one.
         */
        public String asText() {
            return description.isEmpty() ? title : title + "\n\n" + description;
        }
    }
}
