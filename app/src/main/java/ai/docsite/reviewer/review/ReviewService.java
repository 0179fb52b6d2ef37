package ai.docsite.reviewer.review;

import ai.docsite.reviewer.diff.ChangeDetail;
import ai.docsite.reviewer.diff.DiffReconstructor;
import ai.docsite.reviewer.filter.PathFilter;
import ai.docsite.reviewer.git.GitGateway;
import ai.docsite.reviewer.group.ChangeGroup;
import ai.docsite.reviewer.group.ChangeGrouper;
import ai.docsite.reviewer.history.ChangeEntry;
import ai.docsite.reviewer.history.ChangeIndexer;
import ai.docsite.reviewer.history.CommitLogParser;
import ai.docsite.reviewer.history.CommitRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a review pass: reads history since the window start, keeps the documents that pass the filters,
 * groups them by author and path, and rebuilds a diff for each group.
 */
public class ReviewService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewService.class);

    private final GitGateway gateway;
    private final CommitLogParser parser;
    private final ChangeIndexer indexer;
    private final ChangeGrouper grouper;
    private final DiffReconstructor reconstructor;

    public ReviewService(GitGateway gateway, ChangeIndexer indexer) {
        this(gateway, new CommitLogParser(), indexer, new ChangeGrouper(), new DiffReconstructor(gateway));
    }

    public ReviewService(GitGateway gateway,
                         CommitLogParser parser,
                         ChangeIndexer indexer,
                         ChangeGrouper grouper,
                         DiffReconstructor reconstructor) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.indexer = Objects.requireNonNull(indexer, "indexer");
        this.grouper = Objects.requireNonNull(grouper, "grouper");
        this.reconstructor = Objects.requireNonNull(reconstructor, "reconstructor");
    }

    public ReviewReport review(ReviewRequest request) {
        Objects.requireNonNull(request, "request");
        List<ChangeGroup> groups = request.sortOrder().arrange(collectGroups(request));
        List<ChangeDetail> details = reconstructor.reconstructAll(groups);
        LOGGER.info("Review since {} produced {} change groups ({})",
                request.since(), details.size(), request.sortOrder().label());
        return new ReviewReport(request.since(), details);
    }

    public Optional<ChangeDetail> findGroup(ReviewRequest request, String groupId) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(groupId, "groupId");
        Optional<ChangeGroup> match = collectGroups(request).stream()
                .filter(group -> group.groupId().equals(groupId))
                .findFirst();
        if (match.isEmpty()) {
            LOGGER.info("No change group {} since {}", groupId, request.since());
        }
        return match.map(reconstructor::reconstruct);
    }

    public String sync() {
        String result = gateway.sync();
        LOGGER.info("Sync finished: {}", result);
        return result;
    }

    private List<ChangeGroup> collectGroups(ReviewRequest request) {
        List<CommitRecord> commits = parser.parse(gateway.log(request.since()));
        String prefix = gateway.repositoryRootPrefix();
        List<ChangeEntry> entries = indexer.index(commits, PathFilter.of(request.pathFilters()), prefix);
        List<ChangeGroup> groups = grouper.group(entries);
        LOGGER.info("Read {} commits since {}: {} document changes in {} groups",
                commits.size(), request.since(), entries.size(), groups.size());
        return groups;
    }
}
