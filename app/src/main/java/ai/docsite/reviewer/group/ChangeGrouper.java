package ai.docsite.reviewer.group;

import ai.docsite.reviewer.history.ChangeEntry;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds change entries into one {@link ChangeGroup} per (author, document), merging occurrences that are
 * not adjacent in the log.
 *
 * <p>Entries must arrive newest first. The first entry for a key opens the group and fixes its newest
 * commit and id; every later entry for the key is older, so it extends the lists and becomes the new oldest.
 * Groups are returned in the order their keys were first seen.
 */
public class ChangeGrouper {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeGrouper.class);

    public List<ChangeGroup> group(List<ChangeEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<OpenGroup> ordered = new ArrayList<>();
        Map<GroupKey, Integer> positions = new HashMap<>();

        for (ChangeEntry entry : entries) {
            GroupKey key = new GroupKey(entry.author(), entry.filePath());
            Integer position = positions.get(key);
            if (position == null) {
                positions.put(key, ordered.size());
                ordered.add(new OpenGroup(entry));
            } else {
                ordered.get(position).extend(entry);
            }
        }

        List<ChangeGroup> groups = new ArrayList<>(ordered.size());
        for (OpenGroup open : ordered) {
            groups.add(open.toGroup());
        }
        LOGGER.debug("Grouped {} entries into {} change groups", entries.size(), groups.size());
        return List.copyOf(groups);
    }

    private record GroupKey(String author, String filePath) {
    }

    private static final class OpenGroup {

        private final String groupId;
        private final String filePath;
        private final String author;
        private final String newestCommit;
        private final OffsetDateTime newestDate;
        private final List<String> subjects = new ArrayList<>();
        private final List<String> commits = new ArrayList<>();
        private String oldestCommit;
        private OffsetDateTime oldestDate;

        OpenGroup(ChangeEntry first) {
            this.filePath = first.filePath();
            this.author = first.author();
            this.newestCommit = first.commitId();
            this.newestDate = first.timestamp();
            this.groupId = ChangeGroup.idFor(filePath, newestCommit);
            extend(first);
        }

        void extend(ChangeEntry entry) {
            subjects.add(entry.subject());
            commits.add(entry.commitId());
            oldestCommit = entry.commitId();
            oldestDate = entry.timestamp();
        }

        ChangeGroup toGroup() {
            return new ChangeGroup(groupId, filePath, author, newestCommit, oldestCommit,
                    newestDate, oldestDate, subjects, commits);
        }
    }
}
