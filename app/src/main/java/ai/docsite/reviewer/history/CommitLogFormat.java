package ai.docsite.reviewer.history;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Line-oriented log layout shared by the gateway that writes it and {@link CommitLogParser} that reads it.
 *
 * <pre>
 * ==COMMIT==
 * &lt;id&gt;
 * &lt;author name&gt;
 * &lt;author e-mail&gt;
 * &lt;ISO-8601 timestamp with offset&gt;
 * &lt;subject&gt;
 * &lt;path&gt;...
 * </pre>
 */
public final class CommitLogFormat {

    public static final String SENTINEL = "==COMMIT==";
    public static final int METADATA_LINES = 5;
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private CommitLogFormat() {
    }

    public static void appendRecord(StringBuilder builder,
                                    String commitId,
                                    String authorName,
                                    String authorEmail,
                                    OffsetDateTime timestamp,
                                    String subject,
                                    List<String> files) {
        builder.append(SENTINEL).append('\n');
        builder.append(commitId).append('\n');
        builder.append(singleLine(authorName)).append('\n');
        builder.append(singleLine(authorEmail)).append('\n');
        builder.append(TIMESTAMP_FORMAT.format(timestamp)).append('\n');
        builder.append(singleLine(subject)).append('\n');
        for (String file : files) {
            builder.append(file).append('\n');
        }
    }

    private static String singleLine(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\r', ' ').replace('\n', ' ').strip();
    }
}
