package ai.docsite.reviewer.summary;

import ai.docsite.reviewer.diff.ChangeDetail;

/**
 * Produces a short natural-language summary of one change group.
 */
@FunctionalInterface
public interface ChangeSummarizer {

    /**
     * @return the summary, or an empty string when there is nothing to summarize
     * @throws SummaryException if the backing model fails
     */
    String summarize(ChangeDetail detail);

    static ChangeSummarizer disabled() {
        return detail -> "";
    }
}
