package io.feedloom.ai;

import io.feedloom.config.FeedloomSettings;

import java.util.Map;

public final class AiProviders {
    public static final String API_KEY_ENV = "ANTHROPIC_API_KEY";
    public static final String OPENAI_API_KEY_ENV = "OPENAI_API_KEY";

    private AiProviders() {
    }

    public static AiProvider fromSettings(FeedloomSettings.AiSettings ai) {
        return fromSettings(ai, System.getenv());
    }

    static AiProvider fromSettings(FeedloomSettings.AiSettings ai, Map<String, String> env) {
        String provider = ai.provider() == null ? FeedloomSettings.AiSettings.PROVIDER_SCRIPT : ai.provider();
        switch (provider) {
            case FeedloomSettings.AiSettings.PROVIDER_SCRIPT:
                return new ScriptAiProvider("script", ai.command(), ai.model());
            case FeedloomSettings.AiSettings.PROVIDER_ANTHROPIC:
                return new AnthropicAiProvider(apiKey(ai, env, API_KEY_ENV), ai.model(), ai.endpoint());
            case FeedloomSettings.AiSettings.PROVIDER_OPENAI:
                // the endpoint setting defaults to the Anthropic URL
                String endpoint = FeedloomSettings.AiSettings.DEFAULT_ANTHROPIC_ENDPOINT.equals(ai.endpoint())
                        ? OpenAiProvider.DEFAULT_ENDPOINT
                        : ai.endpoint();
                return new OpenAiProvider(apiKey(ai, env, OPENAI_API_KEY_ENV), ai.model(), endpoint);
            default:
                throw new IllegalArgumentException("Unknown AI provider: " + provider
                        + " (expected " + FeedloomSettings.AiSettings.PROVIDER_SCRIPT
                        + ", " + FeedloomSettings.AiSettings.PROVIDER_ANTHROPIC
                        + " or " + FeedloomSettings.AiSettings.PROVIDER_OPENAI + ")");
        }
    }

    private static String apiKey(FeedloomSettings.AiSettings ai, Map<String, String> env, String envName) {
        String key = ai.apiKey();
        if (key == null || key.isBlank()) {
            key = env.getOrDefault(envName, "");
        }
        return key;
    }
}
