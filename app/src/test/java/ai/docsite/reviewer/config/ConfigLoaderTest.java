package ai.docsite.reviewer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.reviewer.cli.CliArguments;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void appliesDefaultsWhenNothingIsConfigured() {
        Config config = new ConfigLoader(key -> Optional.empty()).load(arguments());

        assertThat(config.projectRoot()).isEqualTo(Path.of(".").toAbsolutePath().normalize());
        assertThat(config.lastReviewed()).isEmpty();
        assertThat(config.weeksBack()).isZero();
        assertThat(config.defaultWeekday()).isEqualTo(DayOfWeek.TUESDAY);
        assertThat(config.defaultTime()).isEqualTo(LocalTime.of(15, 0));
        assertThat(config.pathFilters()).isEmpty();
        assertThat(config.documentExtensions()).containsExactly("md");
        assertThat(config.sortOrder()).isEqualTo(SortOrder.NEWEST_FIRST);
        assertThat(config.sync()).isFalse();
        assertThat(config.splitDiff()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.summarizerConfig().enabled()).isFalse();
        assertThat(config.summarizerConfig().provider()).isEqualTo(LlmProvider.OLLAMA);
        assertThat(config.summarizerConfig().baseUrl()).contains("http://localhost:11434");
    }

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = arguments(
                "--project-root", "/tmp/site",
                "--since", "2024-05-07T15:00:00+02:00",
                "--weeks-back", "2",
                "--path-filter", "docs/drafts",
                "--path-filter", "!docs/drafts/keep.md",
                "--sort-order", "oldest-first",
                "--sync",
                "--split",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.projectRoot()).isEqualTo(Path.of("/tmp/site").toAbsolutePath().normalize());
        assertThat(config.lastReviewed()).contains(OffsetDateTime.parse("2024-05-07T15:00:00+02:00"));
        assertThat(config.weeksBack()).isEqualTo(2);
        assertThat(config.pathFilters()).containsExactly("docs/drafts", "!docs/drafts/keep.md");
        assertThat(config.sortOrder()).isEqualTo(SortOrder.OLDEST_FIRST);
        assertThat(config.sync()).isTrue();
        assertThat(config.splitDiff()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> env = new HashMap<>();
        env.put(ConfigLoader.ENV_PROJECT_ROOT, "/srv/docs");
        env.put(ConfigLoader.ENV_LAST_RUN, "2024-05-01T10:00:00Z");
        env.put(ConfigLoader.ENV_DEFAULT_WEEKDAY, "friday");
        env.put(ConfigLoader.ENV_DEFAULT_TIME, "9:30");
        env.put(ConfigLoader.ENV_PATH_FILTERS, "docs/internal, ,!docs/internal/faq.md");
        env.put(ConfigLoader.ENV_DOCUMENT_EXTENSIONS, ".md, MDX");
        env.put(ConfigLoader.ENV_SORT_ORDER, "OLDEST_FIRST");
        env.put(ConfigLoader.ENV_SUMMARIES, "true");
        env.put(ConfigLoader.ENV_LLM_MODEL, "custom-model");
        env.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        env.put(ConfigLoader.ENV_LOG_FORMAT, "json");

        Config config = new ConfigLoader(EnvironmentReader.of(env)).load(arguments());

        assertThat(config.projectRoot()).isEqualTo(Path.of("/srv/docs").toAbsolutePath().normalize());
        assertThat(config.lastReviewed()).contains(OffsetDateTime.parse("2024-05-01T10:00:00Z"));
        assertThat(config.defaultWeekday()).isEqualTo(DayOfWeek.FRIDAY);
        assertThat(config.defaultTime()).isEqualTo(LocalTime.of(9, 30));
        assertThat(config.pathFilters()).containsExactly("docs/internal", "!docs/internal/faq.md");
        assertThat(config.documentExtensions()).containsExactlyInAnyOrder(".md", "MDX");
        assertThat(config.sortOrder()).isEqualTo(SortOrder.OLDEST_FIRST);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.summarizerConfig().enabled()).isTrue();
        assertThat(config.summarizerConfig().modelName()).isEqualTo("custom-model");
        assertThat(config.summarizerConfig().baseUrl()).contains("http://ollama:11434");
    }

    @Test
    void cliOverridesEnvironment() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_LAST_RUN, "2024-05-01T10:00:00Z",
                ConfigLoader.ENV_PATH_FILTERS, "from-env",
                ConfigLoader.ENV_SORT_ORDER, "oldest_first");

        Config config = new ConfigLoader(EnvironmentReader.of(env)).load(arguments(
                "--since", "2024-05-03T00:00:00Z",
                "--path-filter", "from-cli",
                "--sort-order", "newest_first"));

        assertThat(config.lastReviewed()).contains(OffsetDateTime.parse("2024-05-03T00:00:00Z"));
        assertThat(config.pathFilters()).containsExactly("from-cli");
        assertThat(config.sortOrder()).isEqualTo(SortOrder.NEWEST_FIRST);
    }

    @Test
    void geminiSummariesRequireApiKey() {
        Map<String, String> env = Map.of(ConfigLoader.ENV_LLM_PROVIDER, "gemini");
        ConfigLoader loader = new ConfigLoader(EnvironmentReader.of(env));

        assertThatThrownBy(() -> loader.load(arguments("--summarize")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void geminiProviderUsesItsDefaultModelAndKey() {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_LLM_PROVIDER, "gemini",
                ConfigLoader.ENV_GEMINI_API_KEY, "secret-key");

        SummarizerConfig summarizer = new ConfigLoader(EnvironmentReader.of(env)).load(arguments("--summarize")).summarizerConfig();

        assertThat(summarizer.enabled()).isTrue();
        assertThat(summarizer.provider()).isEqualTo(LlmProvider.GEMINI);
        assertThat(summarizer.modelName()).isEqualTo(LlmProvider.GEMINI.defaultModel());
        assertThat(summarizer.baseUrl()).isEmpty();
        assertThat(summarizer.geminiApiKey()).contains("secret-key");
        assertThat(summarizer.toString()).doesNotContain("secret-key");
    }

    @Test
    void rejectsMalformedValues() {
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        assertThatThrownBy(() -> loader.load(arguments("--since", "last tuesday")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ISO-8601");
        assertThatThrownBy(() -> loader.load(arguments("--weeks-back=-1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfigLoader(EnvironmentReader.of(Map.of(ConfigLoader.ENV_DEFAULT_WEEKDAY, "someday")))
                .load(arguments()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfigLoader(EnvironmentReader.of(Map.of(ConfigLoader.ENV_DEFAULT_TIME, "3pm")))
                .load(arguments()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CliArguments arguments(String... args) {
        return CommandLine.populateCommand(new CliArguments(), args);
    }
}
