package github.sarthakdev143.signage_engine.integration.presentation;

/**
 * A request to the presentation controller failed or timed out.
 */
public class PresentationException extends Exception {

    public PresentationException(String message) {
        super(message);
    }

    public PresentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
