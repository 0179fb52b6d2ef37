package ai.docsite.reviewer.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How log lines are rendered on stderr: a human-readable pattern or one JSON object per event.
 */
public enum LogFormat {
    TEXT(false),
    JSON(true);

    private final boolean structured;

    LogFormat(boolean structured) {
        this.structured = structured;
    }

    public boolean structured() {
        return structured;
    }

    public static LogFormat from(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> format.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported log format '" + raw + "', expected one of "
                        + Arrays.stream(values()).map(format -> format.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "))));
    }
}
