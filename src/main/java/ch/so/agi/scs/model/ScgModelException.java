package ch.so.agi.scs.model;

/**
 * Signals a broken element model: dangling or duplicate references, a contour that contains
 * itself, or an unreadable model document. These are defects of whoever produced the model and
 * are not recovered from.
 */
public class ScgModelException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ScgModelException(String message) {
        super(message);
    }

    public ScgModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
