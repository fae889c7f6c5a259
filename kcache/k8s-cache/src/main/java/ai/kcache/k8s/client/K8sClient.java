package ai.kcache.k8s.client;

import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import jakarta.annotation.Nullable;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * CRUD operations on kubernetes objects of one or several clusters.
 */
public interface K8sClient {

    /**
     * Submits the object to the cluster.
     *
     * @param refresh read the object back after creation, so the result carries server-populated fields
     */
    K8sObject create(K8sObject obj, boolean refresh);

    @Nullable
    K8sObject get(K8sObjectMeta meta);

    /**
     * Applies a JSON merge patch (RFC 7386).
     *
     * @throws ai.kcache.k8s.exceptions.NotFoundException if the object does not exist
     */
    K8sObject patch(K8sObjectMeta meta, Map<String, Object> patch);

    /**
     * Applies a JSON patch (RFC 6902), a list of operations like {@code {"op": "replace", "path": ..., "value": ...}}.
     *
     * @throws ai.kcache.k8s.exceptions.NotFoundException if the object does not exist
     */
    K8sObject jsonPatch(K8sObjectMeta meta, List<Map<String, Object>> operations);

    default void delete(K8sObjectMeta meta) {
        delete(meta, DeletionPropagation.FOREGROUND);
    }

    /**
     * Deletes the object, does nothing if it does not exist.
     */
    void delete(K8sObjectMeta meta, DeletionPropagation propagation);

    /**
     * Lazily lists the objects matching the filter. The stream must be closed.
     */
    Stream<K8sObject> list(K8sObjectFilter filter);
}
