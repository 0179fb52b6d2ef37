package ai.docsite.reviewer.config;

import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path projectRoot,
        Optional<OffsetDateTime> lastReviewed,
        int weeksBack,
        DayOfWeek defaultWeekday,
        LocalTime defaultTime,
        List<String> pathFilters,
        Set<String> documentExtensions,
        SortOrder sortOrder,
        boolean sync,
        boolean splitDiff,
        SummarizerConfig summarizerConfig,
        LogFormat logFormat
) {

    private static final Set<String> DEFAULT_DOCUMENT_EXTENSIONS = Set.of("md");

    public Config {
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        lastReviewed = lastReviewed == null ? Optional.empty() : lastReviewed;
        if (weeksBack < 0) {
            throw new IllegalArgumentException("weeksBack must be zero or greater");
        }
        defaultWeekday = Objects.requireNonNull(defaultWeekday, "defaultWeekday");
        defaultTime = Objects.requireNonNull(defaultTime, "defaultTime");
        pathFilters = pathFilters == null
                ? List.of()
                : pathFilters.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        documentExtensions = documentExtensions == null || documentExtensions.isEmpty()
                ? DEFAULT_DOCUMENT_EXTENSIONS
                : Set.copyOf(documentExtensions);
        sortOrder = sortOrder == null ? SortOrder.NEWEST_FIRST : sortOrder;
        summarizerConfig = summarizerConfig == null ? SummarizerConfig.disabled() : summarizerConfig;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }
}
