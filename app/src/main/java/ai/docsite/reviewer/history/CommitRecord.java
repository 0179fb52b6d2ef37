package ai.docsite.reviewer.history;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * One parsed log entry with the files it touched, in log order.
 */
public record CommitRecord(String commitId,
                           String authorName,
                           String authorEmail,
                           OffsetDateTime timestamp,
                           String subject,
                           List<String> files) {

    public CommitRecord {
        Objects.requireNonNull(commitId, "commitId");
        Objects.requireNonNull(authorName, "authorName");
        Objects.requireNonNull(authorEmail, "authorEmail");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(subject, "subject");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
    }
}
