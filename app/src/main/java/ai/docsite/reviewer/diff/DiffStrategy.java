package ai.docsite.reviewer.diff;

import java.util.Optional;

/**
 * One step of the merged-diff fallback chain. Answers empty when it has nothing usable, letting the next step try.
 */
@FunctionalInterface
public interface DiffStrategy {

    Optional<String> attempt(DiffContext context);

    default String name() {
        return getClass().getSimpleName();
    }

    static Optional<String> usable(String diff) {
        if (diff == null || diff.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(diff);
    }
}
