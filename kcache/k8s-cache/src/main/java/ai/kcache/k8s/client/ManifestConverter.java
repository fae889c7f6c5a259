package ai.kcache.k8s.client;

import ai.kcache.k8s.exceptions.ProgrammingException;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import jakarta.annotation.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between cached manifests and fabric8 generic resources.
 */
public class ManifestConverter {
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REFERENCE = new TypeReference<>() { };

    private final ObjectMapper objectMapper;
    private final UserIdExtractor userIdExtractor;

    public ManifestConverter(ObjectMapper objectMapper, UserIdExtractor userIdExtractor) {
        this.objectMapper = objectMapper;
        this.userIdExtractor = userIdExtractor;
    }

    public GenericKubernetesResource toResource(K8sObject obj) {
        var manifest = new LinkedHashMap<>(obj.manifest());
        manifest.put("apiVersion", obj.gvk().groupVersion());
        manifest.put("kind", obj.gvk().kind());

        var metadata = new LinkedHashMap<>(obj.metadata());
        metadata.put("name", obj.name());
        if (obj.namespaced()) {
            metadata.put("namespace", obj.namespace());
        } else {
            metadata.remove("namespace");
        }
        manifest.put("metadata", metadata);

        try {
            return objectMapper.convertValue(manifest, GenericKubernetesResource.class);
        } catch (IllegalArgumentException e) {
            throw new ProgrammingException("Cannot convert manifest of " + obj.meta(), e);
        }
    }

    /**
     * Converts a resource returned by the API server.
     *
     * @param gvk type the resource was requested with, list items may come without apiVersion and kind
     * @param fallbackUserId user id to keep when the labels do not carry one
     */
    public K8sObject toObject(GenericKubernetesResource resource, String cluster, Gvk gvk,
                              @Nullable String fallbackUserId)
    {
        if (resource.getMetadata() == null || resource.getMetadata().getName() == null) {
            throw new ProgrammingException("Kubernetes returned %s object without a name".formatted(gvk));
        }

        Map<String, Object> manifest;
        try {
            manifest = objectMapper.convertValue(resource, MAP_TYPE_REFERENCE);
        } catch (IllegalArgumentException e) {
            throw new ProgrammingException("Cannot convert %s %s to manifest"
                .formatted(gvk, resource.getMetadata().getName()), e);
        }
        manifest.putIfAbsent("apiVersion", gvk.groupVersion());
        manifest.putIfAbsent("kind", gvk.kind());

        var obj = new K8sObject(resource.getMetadata().getName(), resource.getMetadata().getNamespace(), cluster,
            gvk, manifest, null);
        var userId = userIdExtractor.extract(obj);
        return obj.withUserId(userId != null ? userId : fallbackUserId);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProgrammingException("Cannot serialize patch", e);
        }
    }
}
