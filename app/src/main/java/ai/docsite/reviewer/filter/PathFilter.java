package ai.docsite.reviewer.filter;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered include/exclude rules deciding whether a repository path is in scope for review.
 *
 * <p>Every rule is evaluated; the last one that matches decides. A path no rule matches stays in scope.
 * This lets a broad folder exclusion be followed by a narrower {@code !file} rule that re-admits one file.
 */
public final class PathFilter {

    private static final PathFilter NONE = new PathFilter(List.of());

    private final List<PathRule> rules;

    private PathFilter(List<PathRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static PathFilter of(List<String> rules) {
        Objects.requireNonNull(rules, "rules");
        if (rules.isEmpty()) {
            return NONE;
        }
        return new PathFilter(rules.stream()
                .filter(Objects::nonNull)
                .map(PathRule::parse)
                .collect(Collectors.toList()));
    }

    public static PathFilter none() {
        return NONE;
    }

    public static boolean isExcluded(String path, List<String> rules, String prefixToStrip) {
        return of(rules).isExcluded(path, prefixToStrip);
    }

    public boolean isExcluded(String path, String prefixToStrip) {
        return decide(path, prefixToStrip).isExcluded();
    }

    public FilterDecision decide(String path, String prefixToStrip) {
        Objects.requireNonNull(path, "path");
        if (rules.isEmpty()) {
            return FilterDecision.UNSET;
        }
        String normalized = normalize(path, prefixToStrip);
        FilterDecision decision = FilterDecision.UNSET;
        for (PathRule rule : rules) {
            decision = decision.apply(rule, normalized);
        }
        return decision;
    }

    public List<PathRule> rules() {
        return rules;
    }

    static String normalize(String path, String prefixToStrip) {
        String normalized = path.replace('\\', '/');
        if (prefixToStrip != null && !prefixToStrip.isEmpty()) {
            String prefix = prefixToStrip.replace('\\', '/');
            if (normalized.startsWith(prefix)) {
                normalized = normalized.substring(prefix.length());
            }
        }
        return normalized;
    }
}
