package ai.docsite.reviewer.filter;

import java.util.List;
import java.util.Objects;

/**
 * A single filter rule: a glob, optionally prefixed with {@code !} to re-include what earlier rules excluded.
 *
 * <p>A rule matches a path when the glob matches it directly, when the glob names a directory the path
 * lives under, or, for globs without metacharacters, when the path equals or starts with that segment.
 */
public final class PathRule {

    static final char NEGATION_MARKER = '!';

    private final String source;
    private final boolean negated;
    private final String glob;
    private final List<GlobPattern> patterns;
    private final boolean literal;
    private final String literalSegment;

    private PathRule(String source, boolean negated, String glob) {
        this.source = source;
        this.negated = negated;
        this.glob = glob;
        String trimmed = stripTrailingSlashes(glob);
        this.patterns = List.of(
                GlobPattern.compile(glob),
                GlobPattern.compile(trimmed + "/*"),
                GlobPattern.compile(trimmed + "/**"));
        this.literal = !GlobPattern.hasMetacharacters(glob);
        this.literalSegment = trimmed;
    }

    public static PathRule parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String value = raw.strip();
        boolean negated = !value.isEmpty() && value.charAt(0) == NEGATION_MARKER;
        String glob = negated ? value.substring(1) : value;
        return new PathRule(raw, negated, glob);
    }

    public boolean matches(String normalizedPath) {
        if (glob.isEmpty()) {
            return false;
        }
        for (GlobPattern pattern : patterns) {
            if (pattern.matches(normalizedPath)) {
                return true;
            }
        }
        if (literal) {
            return normalizedPath.equals(literalSegment) || normalizedPath.startsWith(literalSegment + "/");
        }
        return false;
    }

    public boolean negated() {
        return negated;
    }

    public String glob() {
        return glob;
    }

    private static String stripTrailingSlashes(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    @Override
    public String toString() {
        return source;
    }
}
