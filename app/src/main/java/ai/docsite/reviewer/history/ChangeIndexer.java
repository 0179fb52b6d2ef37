package ai.docsite.reviewer.history;

import ai.docsite.reviewer.filter.PathFilter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands commits into one {@link ChangeEntry} per touched document that passes the type and path filters.
 *
 * <p>Entries keep log order: commits in input order, then each commit's files in their listed order.
 * A file touched by several commits yields one entry per commit.
 */
public class ChangeIndexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeIndexer.class);

    private final Predicate<String> documentType;

    public ChangeIndexer(Predicate<String> documentType) {
        this.documentType = Objects.requireNonNull(documentType, "documentType");
    }

    public ChangeIndexer() {
        this(DocumentTypeFilter.markdown());
    }

    public List<ChangeEntry> index(List<CommitRecord> commits, PathFilter pathFilter, String prefixToStrip) {
        Objects.requireNonNull(commits, "commits");
        Objects.requireNonNull(pathFilter, "pathFilter");
        List<ChangeEntry> entries = new ArrayList<>();
        int excluded = 0;
        for (CommitRecord commit : commits) {
            for (String file : commit.files()) {
                if (!documentType.test(file)) {
                    continue;
                }
                if (pathFilter.isExcluded(file, prefixToStrip)) {
                    excluded++;
                    continue;
                }
                entries.add(ChangeEntry.of(commit, file));
            }
        }
        LOGGER.debug("Indexed {} document changes from {} commits ({} excluded by path filters)",
                entries.size(), commits.size(), excluded);
        return List.copyOf(entries);
    }
}
