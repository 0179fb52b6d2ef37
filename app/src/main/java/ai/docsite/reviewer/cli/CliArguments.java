package ai.docsite.reviewer.cli;

import ai.docsite.reviewer.config.LogFormat;
import ai.docsite.reviewer.config.SortOrder;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ai-docsite-reviewer", mixinStandardHelpOptions = true, version = "ai-docsite-reviewer 0.1.0",
        description = "Groups recent documentation commits by author and document and prints their diffs for review")
public class CliArguments {

    @CommandLine.Option(names = "--project-root", description = "Directory holding the documents to review", paramLabel = "DIR")
    private Path projectRoot;

    @CommandLine.Option(names = "--since", description = "Start of the review window (ISO-8601 with offset, e.g. 2024-05-07T15:00:00+02:00)", paramLabel = "TIMESTAMP")
    private String since;

    @CommandLine.Option(names = "--weeks-back", description = "Extend the review window this many weeks further back", paramLabel = "WEEKS")
    private Integer weeksBack;

    @CommandLine.Option(names = "--path-filter", description = "Glob excluding paths; prefix with ! to re-include. Later rules win", paramLabel = "GLOB")
    private List<String> pathFilters = new ArrayList<>();

    @CommandLine.Option(names = "--sort-order", converter = OptionConverters.SortOrderConverter.class, description = "newest_first or oldest_first", paramLabel = "ORDER")
    private SortOrder sortOrder;

    @CommandLine.Option(names = "--sync", description = "Pull from the remote before reading history")
    private boolean sync;

    @CommandLine.Option(names = "--split", description = "Print per-commit patches instead of one merged diff")
    private boolean splitDiff;

    @CommandLine.Option(names = "--summarize", description = "Ask the configured chat model for a short summary of each change")
    private boolean summarize;

    @CommandLine.Option(names = "--mark-reviewed", description = "Print REVIEW_LAST_RUN set to now and exit without reviewing")
    private boolean markReviewed;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    public Path projectRoot() {
        return projectRoot;
    }

    public String since() {
        return since;
    }

    public Integer weeksBack() {
        return weeksBack;
    }

    public List<String> pathFilters() {
        return pathFilters == null ? List.of() : List.copyOf(pathFilters);
    }

    public SortOrder sortOrder() {
        return sortOrder;
    }

    public boolean sync() {
        return sync;
    }

    public boolean splitDiff() {
        return splitDiff;
    }

    public boolean summarize() {
        return summarize;
    }

    public boolean markReviewed() {
        return markReviewed;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
