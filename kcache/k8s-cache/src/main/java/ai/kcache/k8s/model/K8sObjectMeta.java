package ai.kcache.k8s.model;

import ai.kcache.k8s.exceptions.ValidationException;
import jakarta.annotation.Nullable;

import java.util.Objects;

/**
 * Identity of a resource in one of the clusters.
 */
public class K8sObjectMeta {
    private final String name;
    @Nullable
    private final String namespace;
    private final String cluster;
    private final Gvk gvk;
    @Nullable
    private final String userId;

    public K8sObjectMeta(String name, @Nullable String namespace, String cluster, Gvk gvk,
                         @Nullable String userId)
    {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Object name is required");
        }
        if (cluster == null || cluster.isBlank()) {
            throw new ValidationException("Cluster id is required for object " + name);
        }
        this.name = name;
        this.namespace = namespace == null || namespace.isEmpty() ? null : namespace;
        this.cluster = cluster;
        this.gvk = Objects.requireNonNull(gvk, "gvk");
        this.userId = userId;
    }

    public K8sObjectMeta(String name, @Nullable String namespace, String cluster, Gvk gvk) {
        this(name, namespace, cluster, gvk, null);
    }

    public String name() {
        return name;
    }

    @Nullable
    public String namespace() {
        return namespace;
    }

    public String cluster() {
        return cluster;
    }

    public Gvk gvk() {
        return gvk;
    }

    @Nullable
    public String userId() {
        return userId;
    }

    public boolean namespaced() {
        return namespace != null;
    }

    public K8sObjectMeta withUserId(@Nullable String userId) {
        return new K8sObjectMeta(name, namespace, cluster, gvk, userId);
    }

    public K8sObjectFilter toFilter() {
        return K8sObjectFilter.builder()
            .name(name)
            .namespace(namespace)
            .cluster(cluster)
            .gvk(gvk)
            .userId(userId)
            .build();
    }

    public K8sObjectMeta meta() {
        return new K8sObjectMeta(name, namespace, cluster, gvk, userId);
    }

    protected boolean sameIdentity(K8sObjectMeta other) {
        return name.equals(other.name)
            && Objects.equals(namespace, other.namespace)
            && cluster.equals(other.cluster)
            && gvk.equals(other.gvk)
            && Objects.equals(userId, other.userId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != K8sObjectMeta.class) {
            return false;
        }
        return sameIdentity((K8sObjectMeta) o);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, namespace, cluster, gvk, userId);
    }

    @Override
    public String toString() {
        return "K8sObjectMeta{name=%s, namespace=%s, cluster=%s, gvk=%s, userId=%s}"
            .formatted(name, namespace, cluster, gvk, userId);
    }
}
