package ai.kcache.k8s.model;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * One configured cluster: its id, the default namespace and the API client bound to it.
 */
public record ClusterConnection(
    String id,
    String namespace,
    KubernetesClient api
) {
    @Override
    public String toString() {
        return "ClusterConnection{id=%s, namespace=%s, master=%s}"
            .formatted(id, namespace, api.getMasterUrl());
    }
}
