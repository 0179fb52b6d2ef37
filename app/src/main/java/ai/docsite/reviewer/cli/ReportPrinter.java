package ai.docsite.reviewer.cli;

import ai.docsite.reviewer.diff.ChangeDetail;
import ai.docsite.reviewer.group.ChangeGroup;
import ai.docsite.reviewer.review.ReviewReport;
import ai.docsite.reviewer.summary.ChangeSummarizer;
import ai.docsite.reviewer.summary.SummaryException;
import java.io.PrintStream;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link ReviewReport} as plain text.
 */
final class ReportPrinter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportPrinter.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm xxx");
    private static final int SHORT_ID_LENGTH = 7;

    private final PrintStream out;
    private final ChangeSummarizer summarizer;
    private final boolean splitDiff;

    ReportPrinter(PrintStream out, ChangeSummarizer summarizer, boolean splitDiff) {
        this.out = Objects.requireNonNull(out, "out");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.splitDiff = splitDiff;
    }

    void print(ReviewReport report) {
        out.printf("Documentation changes since %s: %d group(s)%n", DATE_FORMAT.format(report.since()), report.details().size());
        for (ChangeDetail detail : report.details()) {
            out.println();
            printDetail(detail);
        }
        out.flush();
    }

    private void printDetail(ChangeDetail detail) {
        ChangeGroup group = detail.group();
        out.println("== " + group.filePath() + status(detail));
        out.println("Author:  " + group.author());
        out.println("Group:   " + group.groupId());
        out.println("Commits: " + range(group));
        out.println("Subjects:");
        for (int i = 0; i < group.subjects().size(); i++) {
            out.println("  " + shortId(group.commits().get(i)) + " " + group.subjects().get(i));
        }
        String summary = summarize(detail);
        if (!summary.isEmpty()) {
            out.println("Summary: " + summary);
        }
        String diff = splitDiff ? detail.splitDiff() : detail.mergedDiff();
        out.println(diff.isBlank() ? "(no textual changes)" : diff.stripTrailing());
    }

    private String summarize(ChangeDetail detail) {
        try {
            return summarizer.summarize(detail);
        } catch (SummaryException ex) {
            LOGGER.warn("Summary skipped for {}: {}", detail.groupId(), ex.getMessage());
            return "";
        }
    }

    static String range(ChangeGroup group) {
        String newest = shortId(group.newestCommit()) + " (" + format(group.newestDate()) + ")";
        if (!group.hasMultipleCommits()) {
            return newest;
        }
        return shortId(group.oldestCommit()) + " (" + format(group.oldestDate()) + ") .. " + newest;
    }

    private static String status(ChangeDetail detail) {
        if (detail.isCreation()) {
            return " [created]";
        }
        if (detail.isDeletion()) {
            return " [deleted]";
        }
        return "";
    }

    private static String format(OffsetDateTime timestamp) {
        return DATE_FORMAT.format(timestamp);
    }

    static String shortId(String commitId) {
        return commitId.length() <= SHORT_ID_LENGTH ? commitId : commitId.substring(0, SHORT_ID_LENGTH);
    }
}
