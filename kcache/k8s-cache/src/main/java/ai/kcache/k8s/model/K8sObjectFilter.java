package ai.kcache.k8s.model;

import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Parameters for listing resources from the cache or a cluster. Every non-null field must match.
 *
 * @param group {@link Gvk#CORE_GROUP} matches only the core group, {@code null} matches any group
 * @param labelSelector every entry must be present with an equal value in the object labels
 */
public record K8sObjectFilter(
    @Nullable String name,
    @Nullable String namespace,
    @Nullable String cluster,
    @Nullable String kind,
    @Nullable String version,
    @Nullable String group,
    @Nullable String userId,
    @Nullable Map<String, String> labelSelector
) {
    public static K8sObjectFilter all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .namespace(namespace)
            .cluster(cluster)
            .kind(kind)
            .version(version)
            .group(group)
            .userId(userId)
            .labelSelector(labelSelector);
    }

    public K8sObjectFilter withCluster(@Nullable String clusterId) {
        return toBuilder().cluster(clusterId).build();
    }

    public boolean matchesCoreGroupOnly() {
        return group != null && Gvk.isCoreGroup(group);
    }

    /**
     * Client side evaluation of the filter, used where the backend cannot evaluate it.
     */
    public boolean matches(K8sObject obj) {
        if (name != null && !name.equals(obj.name())) {
            return false;
        }
        if (namespace != null && !namespace.equals(obj.namespace())) {
            return false;
        }
        if (cluster != null && !cluster.equals(obj.cluster())) {
            return false;
        }
        if (kind != null && !kind.equalsIgnoreCase(obj.gvk().kind())) {
            return false;
        }
        if (version != null && !version.equalsIgnoreCase(obj.gvk().version())) {
            return false;
        }
        if (group != null) {
            var objGroup = obj.gvk().group();
            if (matchesCoreGroupOnly() ? objGroup != null : !group.equalsIgnoreCase(objGroup)) {
                return false;
            }
        }
        if (userId != null && !userId.equals(obj.userId())) {
            return false;
        }
        if (labelSelector != null) {
            var labels = obj.labels();
            for (var entry : labelSelector.entrySet()) {
                if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                    return false;
                }
            }
        }
        return true;
    }

    public static final class Builder {
        private String name;
        private String namespace;
        private String cluster;
        private String kind;
        private String version;
        private String group;
        private String userId;
        private Map<String, String> labelSelector;

        private Builder() {}

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder namespace(@Nullable String namespace) {
            this.namespace = namespace == null || namespace.isEmpty() ? null : namespace;
            return this;
        }

        public Builder cluster(@Nullable String cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder kind(@Nullable String kind) {
            this.kind = kind;
            return this;
        }

        public Builder version(@Nullable String version) {
            this.version = version;
            return this;
        }

        public Builder group(@Nullable String group) {
            this.group = group;
            return this;
        }

        /**
         * Exact type match, a core group gvk matches core group objects only.
         */
        public Builder gvk(Gvk gvk) {
            this.kind = gvk.kind();
            this.version = gvk.version();
            this.group = gvk.group() == null ? Gvk.CORE_GROUP : gvk.group();
            return this;
        }

        public Builder userId(@Nullable String userId) {
            this.userId = userId;
            return this;
        }

        public Builder labelSelector(@Nullable Map<String, String> labelSelector) {
            this.labelSelector = labelSelector == null ? null : Map.copyOf(labelSelector);
            return this;
        }

        public K8sObjectFilter build() {
            return new K8sObjectFilter(name, namespace, cluster, kind, version, group, userId, labelSelector);
        }
    }
}
