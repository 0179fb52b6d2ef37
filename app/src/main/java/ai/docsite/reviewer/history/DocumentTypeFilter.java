package ai.docsite.reviewer.history;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Accepts paths whose extension is one of the configured document extensions, ignoring case.
 */
public final class DocumentTypeFilter implements Predicate<String> {

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("md");

    private final Set<String> extensions;

    public DocumentTypeFilter(Set<String> extensions) {
        Objects.requireNonNull(extensions, "extensions");
        this.extensions = extensions.stream()
                .map(DocumentTypeFilter::normalizeExtension)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static DocumentTypeFilter markdown() {
        return new DocumentTypeFilter(DEFAULT_EXTENSIONS);
    }

    @Override
    public boolean test(String path) {
        return path != null && extensions.contains(extensionOf(path));
    }

    public Set<String> extensions() {
        return extensions;
    }

    private static String extensionOf(String path) {
        int idx = path.lastIndexOf('.') + 1;
        if (idx <= 0 || idx == path.length() || path.indexOf('/', idx) >= 0) {
            return "";
        }
        return path.substring(idx).toLowerCase(Locale.ROOT);
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
