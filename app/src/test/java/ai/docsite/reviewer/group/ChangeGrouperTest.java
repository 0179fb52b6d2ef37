package ai.docsite.reviewer.group;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.docsite.reviewer.history.ChangeEntry;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChangeGrouperTest {

    private final ChangeGrouper grouper = new ChangeGrouper();

    @Test
    @DisplayName("Non-adjacent changes by the same author to the same document merge into one group")
    void mergesNonContiguousEntries() {
        List<ChangeEntry> entries = List.of(
                entry("c3", "Alice", 3, "docs/a.md"),
                entry("c2", "Bob", 2, "docs/a.md"),
                entry("c1", "Alice", 1, "docs/a.md"));

        List<ChangeGroup> groups = grouper.group(entries);

        assertThat(groups).hasSize(2);
        ChangeGroup alice = groups.get(0);
        assertThat(alice.author()).isEqualTo("Alice");
        assertThat(alice.commits()).containsExactly("c3", "c1");
        assertThat(alice.subjects()).containsExactly("subject c3", "subject c1");
        assertThat(alice.newestCommit()).isEqualTo("c3");
        assertThat(alice.oldestCommit()).isEqualTo("c1");
        assertThat(alice.newestDate()).isEqualTo(at(3));
        assertThat(alice.oldestDate()).isEqualTo(at(1));
        assertThat(alice.groupId()).isEqualTo("docs/a.md|c3");
        assertThat(alice.hasMultipleCommits()).isTrue();

        ChangeGroup bob = groups.get(1);
        assertThat(bob.commits()).containsExactly("c2");
        assertThat(bob.newestCommit()).isEqualTo(bob.oldestCommit());
        assertThat(bob.hasMultipleCommits()).isFalse();
    }

    @Test
    void interleavedDocumentsFormTwoGroups() {
        List<ChangeEntry> entries = List.of(
                entry("c1", "A", 3, "x.md"),
                entry("c2", "A", 2, "y.md"),
                entry("c3", "A", 1, "x.md"));

        List<ChangeGroup> groups = grouper.group(entries);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0).filePath()).isEqualTo("x.md");
        assertThat(groups.get(0).commits()).containsExactly("c1", "c3");
        assertThat(groups.get(0).newestCommit()).isEqualTo("c1");
        assertThat(groups.get(0).oldestCommit()).isEqualTo("c3");
    }

    @Test
    void keepsFirstSeenOrderAcrossDocuments() {
        List<ChangeEntry> entries = List.of(
                entry("c3", "Alice", 3, "b.md"),
                entry("c3", "Alice", 3, "a.md"),
                entry("c2", "Alice", 2, "c.md"),
                entry("c1", "Alice", 1, "a.md"));

        List<ChangeGroup> groups = grouper.group(entries);

        assertThat(groups).extracting(ChangeGroup::filePath).containsExactly("b.md", "a.md", "c.md");
        assertThat(groups.get(1).commits()).containsExactly("c3", "c1");
    }

    @Test
    void sameDocumentByDifferentAuthorsStaysSeparate() {
        List<ChangeEntry> entries = List.of(
                entry("c2", "Bob", 2, "a.md"),
                entry("c1", "Alice", 1, "a.md"));

        assertThat(grouper.group(entries)).extracting(ChangeGroup::groupId)
                .containsExactly("a.md|c2", "a.md|c1");
    }

    @Test
    void noEntriesNoGroups() {
        assertThat(grouper.group(List.of())).isEmpty();
    }

    @Test
    void rejectsMisalignedSubjectsAndCommits() {
        assertThatThrownBy(() -> new ChangeGroup("a.md|c1", "a.md", "Alice", "c1", "c1", at(1), at(1),
                List.of("one", "two"), List.of("c1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static ChangeEntry entry(String commit, String author, int hour, String path) {
        return new ChangeEntry(commit, author, at(hour), "subject " + commit, path);
    }

    private static OffsetDateTime at(int hour) {
        return OffsetDateTime.of(2024, 5, 7, hour, 0, 0, 0, ZoneOffset.UTC);
    }
}
