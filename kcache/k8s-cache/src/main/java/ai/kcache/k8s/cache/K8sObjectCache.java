package ai.kcache.k8s.cache;

import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import jakarta.annotation.Nullable;

import java.sql.SQLException;
import java.time.Duration;
import java.util.stream.Stream;

/**
 * Durable mirror of Kubernetes objects. Kubernetes stays the source of truth, the cache only
 * accelerates reads and allows queries across clusters.
 * <p>
 * Storage errors are never retried here, they are propagated to the caller as is.
 */
public interface K8sObjectCache {

    /**
     * Inserts the object or replaces the manifest of the stored one with the same identity.
     *
     * @throws ai.kcache.k8s.exceptions.ValidationException if user scoping is enabled and the object
     *                                                      has no user id
     */
    void upsert(K8sObject obj) throws SQLException;

    @Nullable
    K8sObject get(K8sObjectMeta meta) throws SQLException;

    /**
     * Removes the object. Absent objects are ignored.
     */
    void delete(K8sObjectMeta meta) throws SQLException;

    /**
     * Hides the object from reads until it is either upserted again or purged.
     */
    void markDeleted(K8sObjectMeta meta) throws SQLException;

    /**
     * @return number of purged objects
     */
    int purgeDeleted(Duration olderThan) throws SQLException;

    /**
     * Lazily streams matching objects. The stream holds a database connection and must be closed.
     * Failures while consuming it are thrown as {@link ai.kcache.db.exceptions.UncheckedSqlException}.
     */
    Stream<K8sObject> list(K8sObjectFilter filter) throws SQLException;

    boolean requiresUserId();
}
