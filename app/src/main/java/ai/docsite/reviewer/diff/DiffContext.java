package ai.docsite.reviewer.diff;

import ai.docsite.reviewer.group.ChangeGroup;
import java.util.Objects;

/**
 * Everything a {@link DiffStrategy} may consult for one group: resolved refs and the content at each.
 */
public record DiffContext(ChangeGroup group,
                          String baseRef,
                          String headRef,
                          String baseContent,
                          String headContent) {

    public DiffContext {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(baseRef, "baseRef");
        Objects.requireNonNull(headRef, "headRef");
        baseContent = baseContent == null ? "" : baseContent;
        headContent = headContent == null ? "" : headContent;
    }

    public String path() {
        return group.filePath();
    }

    public boolean hasContent() {
        return !baseContent.isEmpty() || !headContent.isEmpty();
    }
}
