package ai.docsite.reviewer.review;

import ai.docsite.reviewer.diff.ChangeDetail;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a complete review pass.
 */
public record ReviewReport(OffsetDateTime since, List<ChangeDetail> details) {

    public ReviewReport {
        Objects.requireNonNull(since, "since");
        details = List.copyOf(Objects.requireNonNull(details, "details"));
    }

    public boolean isEmpty() {
        return details.isEmpty();
    }

    public Optional<ChangeDetail> find(String groupId) {
        return details.stream()
                .filter(detail -> detail.groupId().equals(groupId))
                .findFirst();
    }
}
