package ai.docsite.reviewer.config;

import java.util.Locale;

/**
 * Chat model providers the summarizer can talk to.
 */
public enum LlmProvider {
    GEMINI("models/gemini-1.5-flash-latest"),
    OLLAMA("llama3.1:8b");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
