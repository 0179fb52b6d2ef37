package ai.docsite.reviewer.summary;

import ai.docsite.reviewer.diff.ChangeDetail;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarizer backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelSummarizer implements ChangeSummarizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelSummarizer.class);

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelSummarizer(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String summarize(ChangeDetail detail) {
        Objects.requireNonNull(detail, "detail");
        if (detail.mergedDiff().isBlank()) {
            return "";
        }
        try {
            String response = model.chat(buildPrompt(detail));
            LOGGER.debug("Summarized {} with {} model '{}'", detail.groupId(), providerName, modelName);
            return response == null ? "" : response.strip();
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new SummaryException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new SummaryException("Summary of " + detail.groupId() + " failed", ex);
        }
    }

    String buildPrompt(ChangeDetail detail) {
        return """
Summarize the documentation change below in one or two sentences.
Rules:
- Focus on what a reader of the document would notice: added, removed or reworded content.
- Ignore whitespace-only and formatting-only edits unless nothing else changed.
- Output plain text only. Do not quote the diff and do not add headings.

File: %s
Author: %s

<diff>
""".formatted(detail.group().filePath(), detail.group().author()) + detail.mergedDiff() + "\n</diff>";
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
