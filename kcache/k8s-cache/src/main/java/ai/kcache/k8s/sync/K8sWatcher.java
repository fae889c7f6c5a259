package ai.kcache.k8s.sync;

import ai.kcache.db.exceptions.UncheckedSqlException;
import ai.kcache.k8s.cache.K8sObjectCache;
import ai.kcache.k8s.client.K8sClusterClient;
import ai.kcache.k8s.model.Gvk;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Applies watch events of one kind to the cache.
 */
public class K8sWatcher {
    private static final Logger LOG = LogManager.getLogger(K8sWatcher.class);

    private final K8sObjectCache cache;
    private final K8sCacheSynchronizer synchronizer;

    public K8sWatcher(K8sObjectCache cache, K8sCacheSynchronizer synchronizer) {
        this.cache = cache;
        this.synchronizer = synchronizer;
    }

    /**
     * Blocks until the watch fails or the thread is interrupted.
     */
    public void watch(K8sClusterClient client, Gvk gvk) throws InterruptedException {
        var failed = new CompletableFuture<Void>();

        var watcher = new Watcher<GenericKubernetesResource>() {
            @Override
            public void eventReceived(Action action, GenericKubernetesResource resource) {
                try {
                    handleEvent(client, gvk, action, resource);
                } catch (RuntimeException e) {
                    LOG.error("Cannot apply {} event of {} in cluster {}: {}",
                        action, gvk, client.clusterId(), e.getMessage(), e);
                    failed.completeExceptionally(e);
                }
            }

            @Override
            public void onClose(WatcherException cause) {
                LOG.warn("Watch of {} in cluster {} closed: {}", gvk, client.clusterId(), cause.getMessage());
                failed.completeExceptionally(cause);
            }

            @Override
            public void onClose() {
                LOG.info("Watch of {} in cluster {} closed", gvk, client.clusterId());
            }
        };

        LOG.info("Start watching {} in cluster {}", gvk, client.clusterId());
        try (var ignored = client.watch(gvk, watcher)) {
            failed.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Watch of %s in cluster %s failed".formatted(gvk, client.clusterId()),
                e.getCause());
        }
    }

    void handleEvent(K8sClusterClient client, Gvk gvk, Watcher.Action action, GenericKubernetesResource resource) {
        if (synchronizer.isSyncing(client.clusterId())) {
            LOG.debug("Full sync of cluster {} is running, skip {} event", client.clusterId(), action);
            return;
        }

        try {
            switch (action) {
                case ADDED, MODIFIED -> {
                    var obj = client.toObject(resource, gvk);
                    if (cache.requiresUserId() && obj.userId() == null) {
                        LOG.warn("Object {} has no user id, skip it", obj.meta());
                        return;
                    }
                    cache.upsert(obj);
                }
                case DELETED -> cache.delete(client.toObject(resource, gvk).meta().withUserId(null));
                default -> LOG.debug("Ignore {} event of {} in cluster {}", action, gvk, client.clusterId());
            }
        } catch (SQLException e) {
            throw new UncheckedSqlException(e);
        }
    }
}
