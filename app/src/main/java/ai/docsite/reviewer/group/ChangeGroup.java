package ai.docsite.reviewer.group;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * All in-window changes one author made to one document, merged into a single reviewable unit.
 *
 * <p>{@code subjects} and {@code commits} are index-aligned and in log order (newest first);
 * {@code newestCommit} is the first of them and {@code oldestCommit} the last.
 * {@code groupId} is stable for a given path and newest commit, so callers may key caches on it.
 */
public record ChangeGroup(String groupId,
                          String filePath,
                          String author,
                          String newestCommit,
                          String oldestCommit,
                          OffsetDateTime newestDate,
                          OffsetDateTime oldestDate,
                          List<String> subjects,
                          List<String> commits) {

    public static final String ID_SEPARATOR = "|";

    public ChangeGroup {
        Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(newestCommit, "newestCommit");
        Objects.requireNonNull(oldestCommit, "oldestCommit");
        Objects.requireNonNull(newestDate, "newestDate");
        Objects.requireNonNull(oldestDate, "oldestDate");
        subjects = List.copyOf(Objects.requireNonNull(subjects, "subjects"));
        commits = List.copyOf(Objects.requireNonNull(commits, "commits"));
        if (subjects.size() != commits.size()) {
            throw new IllegalArgumentException("subjects and commits must be the same length");
        }
    }

    public static String idFor(String filePath, String newestCommit) {
        return filePath + ID_SEPARATOR + newestCommit;
    }

    public boolean hasMultipleCommits() {
        return commits.size() > 1;
    }
}
