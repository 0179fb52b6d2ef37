package ai.docsite.reviewer.config;

import ai.docsite.reviewer.cli.CliArguments;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PROJECT_ROOT = "REVIEW_PROJECT_ROOT";
    public static final String ENV_LAST_RUN = "REVIEW_LAST_RUN";
    static final String ENV_DEFAULT_WEEKDAY = "REVIEW_DEFAULT_WEEKDAY";
    static final String ENV_DEFAULT_TIME = "REVIEW_DEFAULT_TIME";
    static final String ENV_PATH_FILTERS = "REVIEW_PATH_FILTERS";
    static final String ENV_DOCUMENT_EXTENSIONS = "REVIEW_DOCUMENT_EXTENSIONS";
    static final String ENV_SORT_ORDER = "REVIEW_SORT_ORDER";
    static final String ENV_SUMMARIES = "REVIEW_SUMMARIES";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_PROJECT_ROOT = ".";
    private static final DayOfWeek DEFAULT_WEEKDAY = DayOfWeek.TUESDAY;
    private static final LocalTime DEFAULT_TIME = LocalTime.of(15, 0);
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        Path projectRoot = Optional.ofNullable(arguments.projectRoot())
                .or(() -> environmentReader.getNonBlank(ENV_PROJECT_ROOT).map(value -> Path.of(value)))
                .orElse(Path.of(DEFAULT_PROJECT_ROOT));

        Optional<OffsetDateTime> lastReviewed = Optional.ofNullable(arguments.since())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.getNonBlank(ENV_LAST_RUN))
                .map(ConfigLoader::parseTimestamp);

        int weeksBack = resolveWeeksBack(arguments);

        DayOfWeek defaultWeekday = environmentReader.getNonBlank(ENV_DEFAULT_WEEKDAY)
                .map(ConfigLoader::parseWeekday)
                .orElse(DEFAULT_WEEKDAY);
        LocalTime defaultTime = environmentReader.getNonBlank(ENV_DEFAULT_TIME)
                .map(ConfigLoader::parseTime)
                .orElse(DEFAULT_TIME);

        List<String> pathFilters = arguments.pathFilters().isEmpty()
                ? environmentReader.getNonBlank(ENV_PATH_FILTERS).map(ConfigLoader::parseList).orElse(List.of())
                : arguments.pathFilters();

        Set<String> documentExtensions = environmentReader.getNonBlank(ENV_DOCUMENT_EXTENSIONS)
                .map(ConfigLoader::parseDocumentExtensions)
                .orElse(Set.of());

        SortOrder sortOrder = Optional.ofNullable(arguments.sortOrder())
                .or(() -> environmentReader.getNonBlank(ENV_SORT_ORDER).map(SortOrder::from))
                .orElse(SortOrder.NEWEST_FIRST);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.getNonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);

        return new Config(projectRoot, lastReviewed, weeksBack, defaultWeekday, defaultTime, pathFilters,
                documentExtensions, sortOrder, arguments.sync(), arguments.splitDiff(), resolveSummarizer(arguments), logFormat);
    }

    private SummarizerConfig resolveSummarizer(CliArguments arguments) {
        boolean enabled = arguments.summarize() || environmentReader.getNonBlank(ENV_SUMMARIES)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        LlmProvider provider = environmentReader.getNonBlank(ENV_LLM_PROVIDER)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);
        String modelName = environmentReader.getNonBlank(ENV_LLM_MODEL)
                .orElse(provider.defaultModel());

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.getNonBlank(ENV_OLLAMA_BASE_URL).orElse(DEFAULT_OLLAMA_BASE_URL));
        }

        Optional<String> geminiApiKey = environmentReader.getNonBlank(ENV_GEMINI_API_KEY);
        if (enabled && provider == LlmProvider.GEMINI && geminiApiKey.isEmpty()) {
            throw new IllegalStateException("GEMINI_API_KEY must be provided when summaries use LLM_PROVIDER=gemini");
        }
        return new SummarizerConfig(enabled, provider, modelName, baseUrl, geminiApiKey);
    }

    private int resolveWeeksBack(CliArguments arguments) {
        Integer weeks = arguments.weeksBack();
        if (weeks == null) {
            return 0;
        }
        if (weeks < 0) {
            throw new IllegalArgumentException("--weeks-back must be zero or greater");
        }
        return weeks;
    }

    private static OffsetDateTime parseTimestamp(String raw) {
        try {
            return OffsetDateTime.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Review start must be an ISO-8601 timestamp with offset: " + raw, ex);
        }
    }

    private static DayOfWeek parseWeekday(String raw) {
        try {
            return DayOfWeek.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported weekday: " + raw, ex);
        }
    }

    private static LocalTime parseTime(String raw) {
        try {
            return LocalTime.parse(raw.trim(), TIME_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Default review time must be HH:MM: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    private static Set<String> parseDocumentExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
