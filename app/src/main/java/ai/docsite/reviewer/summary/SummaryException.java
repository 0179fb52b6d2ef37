package ai.docsite.reviewer.summary;

/**
 * Runtime exception used to propagate summarization failures.
 */
public class SummaryException extends RuntimeException {

    public SummaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
