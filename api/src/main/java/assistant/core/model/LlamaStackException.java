package assistant.core.model;

/**
 * Exception thrown when llama-stack answers with an error or an unusable body,
 * or cannot be reached at all.
 */
public class LlamaStackException extends RuntimeException {

    public LlamaStackException(String message) {
        super(message);
    }

    public LlamaStackException(String message, Throwable cause) {
        super(message, cause);
    }
}
