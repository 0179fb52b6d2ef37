package ai.docsite.reviewer.git;

/**
 * Runtime exception raised when the repository cannot be queried at all.
 */
public class GitGatewayException extends RuntimeException {

    public GitGatewayException(String message) {
        super(message);
    }

    public GitGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
