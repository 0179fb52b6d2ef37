package ai.docsite.reviewer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Order in which change details are presented. Log order is newest first.
 */
public enum SortOrder {
    NEWEST_FIRST,
    OLDEST_FIRST;

    public static SortOrder from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NEWEST_FIRST;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (SortOrder order : values()) {
            if (order.name().equals(normalized)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unsupported sort order: " + raw);
    }

    public <T> List<T> arrange(List<T> newestFirst) {
        if (this == NEWEST_FIRST) {
            return List.copyOf(newestFirst);
        }
        List<T> reversed = new ArrayList<>(newestFirst);
        Collections.reverse(reversed);
        return List.copyOf(reversed);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
