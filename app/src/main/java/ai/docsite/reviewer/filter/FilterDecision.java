package ai.docsite.reviewer.filter;

/**
 * Running verdict while rules are folded over a path; the last matching rule decides.
 */
public enum FilterDecision {
    UNSET,
    EXCLUDE,
    INCLUDE;

    public FilterDecision apply(PathRule rule, String path) {
        if (!rule.matches(path)) {
            return this;
        }
        return rule.negated() ? INCLUDE : EXCLUDE;
    }

    public boolean isExcluded() {
        return this == EXCLUDE;
    }
}
