package ai.docsite.reviewer.diff;

import ai.docsite.reviewer.group.ChangeGroup;
import java.util.Objects;

/**
 * A change group with its reconstructed base/head content and both diff views.
 *
 * <p>Empty {@code baseContent} means the document was created inside the window; empty
 * {@code headContent} means it was deleted.
 */
public record ChangeDetail(ChangeGroup group,
                           String mergedDiff,
                           String splitDiff,
                           String baseContent,
                           String headContent) {

    public ChangeDetail {
        Objects.requireNonNull(group, "group");
        mergedDiff = mergedDiff == null ? "" : mergedDiff;
        splitDiff = splitDiff == null ? "" : splitDiff;
        baseContent = baseContent == null ? "" : baseContent;
        headContent = headContent == null ? "" : headContent;
    }

    public String groupId() {
        return group.groupId();
    }

    public boolean isCreation() {
        return baseContent.isEmpty() && !headContent.isEmpty();
    }

    public boolean isDeletion() {
        return !baseContent.isEmpty() && headContent.isEmpty();
    }
}
