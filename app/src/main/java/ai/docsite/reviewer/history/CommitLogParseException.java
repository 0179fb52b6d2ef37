package ai.docsite.reviewer.history;

/**
 * Raised when a log record carries a value the log query never produces, such as an unparseable timestamp.
 */
public class CommitLogParseException extends RuntimeException {

    public CommitLogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
