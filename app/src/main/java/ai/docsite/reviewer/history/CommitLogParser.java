package ai.docsite.reviewer.history;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses sentinel-delimited log text into {@link CommitRecord}s, preserving log order.
 */
public class CommitLogParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommitLogParser.class);

    public List<CommitRecord> parse(String output) {
        if (output == null || output.isEmpty()) {
            return List.of();
        }
        List<String> lines = output.lines().toList();
        List<CommitRecord> records = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            if (!CommitLogFormat.SENTINEL.equals(lines.get(index))) {
                index++;
                continue;
            }
            if (index + CommitLogFormat.METADATA_LINES >= lines.size()) {
                LOGGER.warn("Discarding truncated log record at line {}", index + 1);
                break;
            }
            String commitId = lines.get(index + 1).strip();
            String authorName = lines.get(index + 2).strip();
            String authorEmail = lines.get(index + 3).strip();
            OffsetDateTime timestamp = parseTimestamp(commitId, lines.get(index + 4).strip());
            String subject = lines.get(index + 5).strip();
            index += CommitLogFormat.METADATA_LINES + 1;

            List<String> files = new ArrayList<>();
            while (index < lines.size() && !CommitLogFormat.SENTINEL.equals(lines.get(index))) {
                String path = lines.get(index).strip();
                if (!path.isEmpty()) {
                    files.add(path);
                }
                index++;
            }
            records.add(new CommitRecord(commitId, authorName, authorEmail, timestamp, subject, files));
        }
        LOGGER.debug("Parsed {} commits from log output", records.size());
        return List.copyOf(records);
    }

    private OffsetDateTime parseTimestamp(String commitId, String raw) {
        try {
            return OffsetDateTime.parse(raw, CommitLogFormat.TIMESTAMP_FORMAT);
        } catch (DateTimeParseException ex) {
            throw new CommitLogParseException("Commit " + commitId + " has an unparseable timestamp '" + raw + "'", ex);
        }
    }
}
