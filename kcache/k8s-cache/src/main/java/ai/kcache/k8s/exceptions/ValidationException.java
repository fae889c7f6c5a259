package ai.kcache.k8s.exceptions;

/**
 * Malformed object metadata or filter. Retrying the same call cannot succeed.
 */
public class ValidationException extends KcacheException {

    public ValidationException(String message) {
        super(message);
    }
}
