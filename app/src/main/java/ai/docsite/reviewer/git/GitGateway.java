package ai.docsite.reviewer.git;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Read-only query surface over a version-control working copy, plus the explicit {@link #sync()} call.
 *
 * <p>Queries for refs or paths that do not exist answer with empty text or {@link Optional#empty()}.
 * A repository that cannot be read at all raises {@link GitGatewayException}.
 */
public interface GitGateway extends AutoCloseable {

    /** Id of the tree with no entries; used as the base of a root commit. */
    String EMPTY_TREE = "4b825dc642cb6eb9a060e54bf8d69288fbee4904";

    /**
     * Renders the commits made after {@code since}, newest first, in the sentinel-delimited
     * format described by {@link ai.docsite.reviewer.history.CommitLogFormat}.
     */
    String log(OffsetDateTime since);

    Optional<String> showFileAt(String ref, String path);

    String diffBetween(String baseRef, String headRef, String path);

    /**
     * Full patch of a single commit against each of its parents, or against the empty tree for a root commit.
     */
    String patchOfCommit(String commitId);

    Optional<String> resolveParent(String commitId);

    /**
     * Path segment from the repository root to the configured project root, ending in {@code /}, or empty.
     */
    String repositoryRootPrefix();

    /**
     * Pulls from the tracked remote. This mutates the working copy and must not overlap a read pass.
     */
    String sync();

    @Override
    void close();
}
