package ai.docsite.reviewer.diff;

import ai.docsite.reviewer.git.GitGateway;
import java.util.Objects;
import java.util.Optional;

/**
 * Uses the head commit's own patch for the document. Covers merge commits, where the ranged diff
 * against a synthetic base comes back empty.
 */
public class CommitPatchStrategy implements DiffStrategy {

    private final GitGateway gateway;
    private final CommitPatchExtractor extractor;

    public CommitPatchStrategy(GitGateway gateway, CommitPatchExtractor extractor) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public Optional<String> attempt(DiffContext context) {
        String patch = gateway.patchOfCommit(context.headRef());
        return DiffStrategy.usable(extractor.extract(patch, context.path()));
    }
}
