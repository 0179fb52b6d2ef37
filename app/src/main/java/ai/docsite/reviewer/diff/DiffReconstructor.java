package ai.docsite.reviewer.diff;

import ai.docsite.reviewer.git.GitGateway;
import ai.docsite.reviewer.group.ChangeGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs base/head content and the merged and split diffs for each change group.
 *
 * <p>The base is the parent of the group's oldest commit, or {@link GitGateway#EMPTY_TREE} for a root commit;
 * the head is the newest commit. The merged diff comes from the first strategy in the chain that yields text.
 * The split diff joins each commit's own patch for the document, skipping empty ones, and equals the merged
 * diff for single-commit groups.
 */
public class DiffReconstructor {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiffReconstructor.class);
    private static final String PATCH_SEPARATOR = "\n";

    private final GitGateway gateway;
    private final List<DiffStrategy> strategies;
    private final CommitPatchExtractor extractor;

    public DiffReconstructor(GitGateway gateway) {
        this(gateway, new CommitPatchExtractor());
    }

    private DiffReconstructor(GitGateway gateway, CommitPatchExtractor extractor) {
        this(gateway, defaultStrategies(gateway, extractor), extractor);
    }

    public DiffReconstructor(GitGateway gateway, List<DiffStrategy> strategies, CommitPatchExtractor extractor) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public static List<DiffStrategy> defaultStrategies(GitGateway gateway, CommitPatchExtractor extractor) {
        return List.of(
                new RangedDiffStrategy(gateway),
                new CommitPatchStrategy(gateway, extractor),
                new ContentDiffStrategy());
    }

    public List<ChangeDetail> reconstructAll(List<ChangeGroup> groups) {
        Objects.requireNonNull(groups, "groups");
        List<ChangeDetail> details = new ArrayList<>(groups.size());
        for (ChangeGroup group : groups) {
            details.add(reconstruct(group));
        }
        return List.copyOf(details);
    }

    public ChangeDetail reconstruct(ChangeGroup group) {
        Objects.requireNonNull(group, "group");
        String baseRef = gateway.resolveParent(group.oldestCommit()).orElse(GitGateway.EMPTY_TREE);
        String headRef = group.newestCommit();
        String baseContent = gateway.showFileAt(baseRef, group.filePath()).orElse("");
        String headContent = gateway.showFileAt(headRef, group.filePath()).orElse("");

        DiffContext context = new DiffContext(group, baseRef, headRef, baseContent, headContent);
        String mergedDiff = mergedDiff(context);
        String splitDiff = group.hasMultipleCommits() ? splitDiff(group) : mergedDiff;
        return new ChangeDetail(group, mergedDiff, splitDiff, baseContent, headContent);
    }

    String mergedDiff(DiffContext context) {
        for (DiffStrategy strategy : strategies) {
            Optional<String> diff = strategy.attempt(context);
            if (diff.isPresent()) {
                LOGGER.debug("Merged diff for {} produced by {}", context.group().groupId(), strategy.name());
                return diff.get();
            }
        }
        LOGGER.debug("No diff available for {}", context.group().groupId());
        return "";
    }

    String splitDiff(ChangeGroup group) {
        List<String> patches = new ArrayList<>();
        for (String commit : group.commits()) {
            String patch = extractor.extract(gateway.patchOfCommit(commit), group.filePath());
            if (!patch.isBlank()) {
                patches.add(patch);
            }
        }
        return String.join(PATCH_SEPARATOR, patches);
    }
}
