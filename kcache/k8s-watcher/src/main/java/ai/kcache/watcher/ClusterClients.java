package ai.kcache.watcher;

import ai.kcache.k8s.client.K8sCachedClusterClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Cached clients of every configured cluster, owns the API connections.
 */
public class ClusterClients implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ClusterClients.class);

    private final List<K8sCachedClusterClient> clients;

    public ClusterClients(List<K8sCachedClusterClient> clients) {
        this.clients = List.copyOf(clients);
    }

    public List<K8sCachedClusterClient> clients() {
        return clients;
    }

    @Override
    public void close() {
        for (var client : clients) {
            LOG.info("Close connection to cluster {}", client.cluster().id());
            client.cluster().api().close();
        }
    }
}
