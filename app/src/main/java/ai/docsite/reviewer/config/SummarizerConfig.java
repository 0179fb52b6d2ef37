package ai.docsite.reviewer.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the chat model that writes change summaries.
 */
public record SummarizerConfig(boolean enabled,
                               LlmProvider provider,
                               String modelName,
                               Optional<String> baseUrl,
                               Optional<String> geminiApiKey) {

    public SummarizerConfig {
        provider = Objects.requireNonNull(provider, "provider");
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
        geminiApiKey = geminiApiKey == null ? Optional.empty() : geminiApiKey;
    }

    public static SummarizerConfig disabled() {
        return new SummarizerConfig(false, LlmProvider.OLLAMA, LlmProvider.OLLAMA.defaultModel(), Optional.empty(), Optional.empty());
    }

    @Override
    public String toString() {
        return "SummarizerConfig[enabled=" + enabled + ", provider=" + provider + ", modelName=" + modelName
                + ", baseUrl=" + baseUrl.orElse("-") + ", geminiApiKey=" + (geminiApiKey.isPresent() ? "***" : "-") + "]";
    }
}
