package ai.kcache.k8s.exceptions;

/**
 * Broken internal invariant.
 */
public class ProgrammingException extends KcacheException {

    public ProgrammingException(String message) {
        super(message);
    }

    public ProgrammingException(String message, Throwable cause) {
        super(message, cause);
    }
}
