package ai.kcache.k8s.client;

import ai.kcache.k8s.exceptions.NotFoundException;
import ai.kcache.k8s.exceptions.ValidationException;
import ai.kcache.k8s.model.ClusterConnection;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Routes requests to the client of the cluster an object belongs to.
 * Lists without a cluster go to every cluster in registration order.
 */
public class K8sClusterClientsPool implements K8sClient {
    private static final Logger LOG = LogManager.getLogger(K8sClusterClientsPool.class);

    public record ClusterClient(ClusterConnection connection, K8sClient client) {}

    private final Map<String, ClusterClient> clients = new LinkedHashMap<>();

    public K8sClusterClientsPool(List<ClusterClient> clients) {
        for (var cc : clients) {
            var prev = this.clients.putIfAbsent(cc.connection().id(), cc);
            if (prev != null) {
                throw new ValidationException("Cluster %s is configured twice".formatted(cc.connection().id()));
            }
        }
        LOG.info("Clusters pool: {}", this.clients.keySet());
    }

    public static K8sClusterClientsPool of(List<K8sCachedClusterClient> clients) {
        var list = new ArrayList<ClusterClient>(clients.size());
        for (var client : clients) {
            list.add(new ClusterClient(client.cluster(), client));
        }
        return new K8sClusterClientsPool(list);
    }

    public List<ClusterConnection> clusters() {
        return clients.values().stream().map(ClusterClient::connection).toList();
    }

    public List<String> clusterIds() {
        return Collections.unmodifiableList(new ArrayList<>(clients.keySet()));
    }

    public ClusterConnection clusterById(String clusterId) {
        return lookup(clusterId).connection();
    }

    public K8sClient clientById(String clusterId) {
        return lookup(clusterId).client();
    }

    private ClusterClient lookup(String clusterId) {
        var cc = clients.get(clusterId);
        if (cc == null) {
            throw new NotFoundException("Cluster %s not found".formatted(clusterId));
        }
        return cc;
    }

    @Override
    public K8sObject create(K8sObject obj, boolean refresh) {
        return clientById(obj.cluster()).create(obj, refresh);
    }

    @Nullable
    @Override
    public K8sObject get(K8sObjectMeta meta) {
        return clientById(meta.cluster()).get(meta);
    }

    @Override
    public K8sObject patch(K8sObjectMeta meta, Map<String, Object> patch) {
        return clientById(meta.cluster()).patch(meta, patch);
    }

    @Override
    public K8sObject jsonPatch(K8sObjectMeta meta, List<Map<String, Object>> operations) {
        return clientById(meta.cluster()).jsonPatch(meta, operations);
    }

    @Override
    public void delete(K8sObjectMeta meta, DeletionPropagation propagation) {
        clientById(meta.cluster()).delete(meta, propagation);
    }

    @Override
    public Stream<K8sObject> list(K8sObjectFilter filter) {
        if (filter.cluster() != null) {
            return clientById(filter.cluster()).list(filter);
        }

        // each cluster stream is opened only when the previous one is exhausted
        return clients.values().stream()
            .flatMap(cc -> cc.client().list(filter));
    }
}
