package ai.docsite.reviewer.diff;

import ai.docsite.reviewer.git.GitGateway;
import java.util.Objects;
import java.util.Optional;

/**
 * Asks the repository for the diff of the document between base and head.
 */
public class RangedDiffStrategy implements DiffStrategy {

    private final GitGateway gateway;

    public RangedDiffStrategy(GitGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    @Override
    public Optional<String> attempt(DiffContext context) {
        return DiffStrategy.usable(gateway.diffBetween(context.baseRef(), context.headRef(), context.path()));
    }
}
