package ai.docsite.reviewer.diff;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Last resort: builds a unified diff straight from the base and head text, so a document whose content
 * changed always gets a diff even when the repository could not express one (for example across a rename).
 */
public class ContentDiffStrategy implements DiffStrategy {

    private static final String DEV_NULL = "/dev/null";

    private final DiffAlgorithm algorithm;
    private final int contextLines;

    public ContentDiffStrategy() {
        this(DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM), 3);
    }

    public ContentDiffStrategy(DiffAlgorithm algorithm, int contextLines) {
        this.algorithm = algorithm;
        this.contextLines = contextLines;
    }

    @Override
    public Optional<String> attempt(DiffContext context) {
        if (!context.hasContent()) {
            return Optional.empty();
        }
        return DiffStrategy.usable(synthesize(context.path(), context.baseContent(), context.headContent()));
    }

    public String synthesize(String path, String baseContent, String headContent) {
        RawText base = new RawText(baseContent.getBytes(StandardCharsets.UTF_8));
        RawText head = new RawText(headContent.getBytes(StandardCharsets.UTF_8));
        EditList edits = algorithm.diff(RawTextComparator.DEFAULT, base, head);
        if (edits.isEmpty()) {
            return "";
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (DiffFormatter formatter = new DiffFormatter(out)) {
            formatter.setContext(contextLines);
            formatter.format(edits, base, head);
            formatter.flush();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to format diff for " + path, ex);
        }

        String normalized = path.replace('\\', '/');
        StringBuilder diff = new StringBuilder();
        diff.append("diff --git a/").append(normalized).append(" b/").append(normalized).append('\n');
        diff.append("--- ").append(baseContent.isEmpty() ? DEV_NULL : "a/" + normalized).append('\n');
        diff.append("+++ ").append(headContent.isEmpty() ? DEV_NULL : "b/" + normalized).append('\n');
        diff.append(out.toString(StandardCharsets.UTF_8));
        return diff.toString();
    }
}
