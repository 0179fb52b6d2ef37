package ai.docsite.reviewer.history;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * One in-scope document touched by one commit.
 */
public record ChangeEntry(String commitId, String author, OffsetDateTime timestamp, String subject, String filePath) {

    public ChangeEntry {
        Objects.requireNonNull(commitId, "commitId");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(filePath, "filePath");
    }

    static ChangeEntry of(CommitRecord commit, String filePath) {
        return new ChangeEntry(commit.commitId(), commit.authorName(), commit.timestamp(), commit.subject(), filePath);
    }
}
