package ai.kcache.k8s.model;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

public class K8sObject extends K8sObjectMeta {
    private final Map<String, Object> manifest;

    public K8sObject(String name, @Nullable String namespace, String cluster, Gvk gvk,
                     Map<String, Object> manifest, @Nullable String userId)
    {
        super(name, namespace, cluster, gvk, userId);
        this.manifest = manifest == null ? Map.of() : Collections.unmodifiableMap(manifest);
    }

    public Map<String, Object> manifest() {
        return manifest;
    }

    @Override
    public K8sObject withUserId(@Nullable String userId) {
        return new K8sObject(name(), namespace(), cluster(), gvk(), manifest, userId);
    }

    public Map<String, String> labels() {
        return stringMap(metadata().get("labels"));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> metadata() {
        if (manifest.get("metadata") instanceof Map<?, ?> metadata) {
            return (Map<String, Object>) metadata;
        }
        return Map.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> stringMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, String>) map;
        }
        return Map.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof K8sObject other)) {
            return false;
        }
        return sameIdentity(other) && manifest.equals(other.manifest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), manifest);
    }

    @Override
    public String toString() {
        return "K8sObject{name=%s, namespace=%s, cluster=%s, gvk=%s, userId=%s, manifest=%s}"
            .formatted(name(), namespace(), cluster(), gvk(), userId(), manifest);
    }
}
