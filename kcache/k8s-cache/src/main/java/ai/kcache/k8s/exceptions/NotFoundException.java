package ai.kcache.k8s.exceptions;

/**
 * Referenced cluster or object does not exist.
 */
public class NotFoundException extends KcacheException {

    public NotFoundException(String message) {
        super(message);
    }
}
