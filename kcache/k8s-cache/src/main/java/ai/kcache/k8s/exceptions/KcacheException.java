package ai.kcache.k8s.exceptions;

public abstract class KcacheException extends RuntimeException {

    protected KcacheException(String message) {
        super(message);
    }

    protected KcacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
