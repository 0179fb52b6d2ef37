package ai.docsite.reviewer.diff;

/**
 * Cuts the blocks for one file out of a multi-file commit patch.
 *
 * <p>A block starts at a {@code diff --git a/<old> b/<new>} header naming the path on either side and runs
 * until the next header. Paths are compared whole, so {@code a.md} never picks up {@code data.md} or
 * {@code docs/a.md}. Merge commits may contribute several blocks for the same file; all of them are kept.
 */
public class CommitPatchExtractor {

    static final String BLOCK_HEADER = "diff --git ";

    public String extract(String fullPatch, String filePath) {
        if (fullPatch == null || fullPatch.isEmpty() || filePath == null || filePath.isEmpty()) {
            return "";
        }
        String normalizedPath = filePath.replace('\\', '/');
        StringBuilder result = new StringBuilder();
        boolean capturing = false;
        int start = 0;
        int length = fullPatch.length();
        while (start < length) {
            int newline = fullPatch.indexOf('\n', start);
            int end = newline < 0 ? length : newline + 1;
            String line = fullPatch.substring(start, end);
            if (line.startsWith(BLOCK_HEADER)) {
                capturing = headerNames(line, normalizedPath);
            }
            if (capturing) {
                result.append(line);
            }
            start = end;
        }
        return result.toString();
    }

    static boolean headerNames(String headerLine, String path) {
        String header = headerLine.stripTrailing();
        String oldSide = BLOCK_HEADER + "a/" + path + " b/";
        return header.startsWith(oldSide) || header.endsWith(" b/" + path);
    }
}
