package ai.docsite.reviewer.review;

import ai.docsite.reviewer.config.Config;
import ai.docsite.reviewer.config.SortOrder;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one review pass: window start, filter rules and presentation order.
 */
public record ReviewRequest(OffsetDateTime since, List<String> pathFilters, SortOrder sortOrder) {

    public ReviewRequest {
        Objects.requireNonNull(since, "since");
        pathFilters = pathFilters == null ? List.of() : List.copyOf(pathFilters);
        sortOrder = sortOrder == null ? SortOrder.NEWEST_FIRST : sortOrder;
    }

    public static ReviewRequest from(Config config, OffsetDateTime since) {
        return new ReviewRequest(since, config.pathFilters(), config.sortOrder());
    }
}
