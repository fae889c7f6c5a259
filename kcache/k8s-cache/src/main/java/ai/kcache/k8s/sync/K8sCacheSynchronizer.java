package ai.kcache.k8s.sync;

import ai.kcache.k8s.cache.K8sObjectCache;
import ai.kcache.k8s.client.K8sClusterClient;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Brings the cache in line with the cluster: upserts every live object of the synced kinds
 * and marks the cache entries which are gone from the cluster as deleted.
 */
public class K8sCacheSynchronizer {
    private static final Logger LOG = LogManager.getLogger(K8sCacheSynchronizer.class);

    public record SyncResult(int upserted, int skipped, int removed) {}

    private final K8sObjectCache cache;
    private final List<Gvk> kinds;
    private final Duration deletedRetention;
    private final Set<String> syncingClusters = ConcurrentHashMap.newKeySet();

    public K8sCacheSynchronizer(K8sObjectCache cache, List<Gvk> kinds, Duration deletedRetention) {
        this.cache = cache;
        this.kinds = List.copyOf(kinds);
        this.deletedRetention = deletedRetention;
    }

    public List<Gvk> kinds() {
        return kinds;
    }

    public boolean isSyncing(String clusterId) {
        return syncingClusters.contains(clusterId);
    }

    public SyncResult sync(K8sClusterClient client, Gvk gvk) throws SQLException {
        var clusterId = client.clusterId();
        var namespace = client.cluster().namespace();
        var filter = K8sObjectFilter.builder()
            .cluster(clusterId)
            .namespace(namespace)
            .gvk(gvk)
            .build();

        var upserted = 0;
        var skipped = 0;
        var alive = new HashSet<K8sObjectMeta>();

        List<K8sObject> liveObjects;
        try (var stream = client.list(filter)) {
            liveObjects = stream.collect(Collectors.toList());
        }
        for (var obj : liveObjects) {
            alive.add(identity(obj));
            if (cache.requiresUserId() && obj.userId() == null) {
                LOG.warn("Object {} has no user id, skip it", obj.meta());
                skipped++;
                continue;
            }
            cache.upsert(obj);
            upserted++;
        }

        List<K8sObject> cached;
        try (var stream = cache.list(filter)) {
            cached = stream.collect(Collectors.toList());
        }
        var removed = 0;
        for (var obj : cached) {
            if (!alive.contains(identity(obj))) {
                LOG.info("Object {} is gone from cluster {}, mark it deleted", obj.meta(), clusterId);
                cache.markDeleted(identity(obj));
                removed++;
            }
        }

        var result = new SyncResult(upserted, skipped, removed);
        LOG.debug("Synced {} of cluster {}: {}", gvk, clusterId, result);
        return result;
    }

    /**
     * Syncs every configured kind, then purges entries deleted longer than the retention period ago.
     * Watch events of the cluster are not applied meanwhile.
     */
    public void fullSync(K8sClusterClient client) throws SQLException {
        var clusterId = client.clusterId();
        if (!syncingClusters.add(clusterId)) {
            LOG.warn("Full sync of cluster {} is already running", clusterId);
            return;
        }
        try {
            LOG.info("Full sync of cluster {} started", clusterId);
            for (var gvk : kinds) {
                sync(client, gvk);
            }
            cache.purgeDeleted(deletedRetention);
            LOG.info("Full sync of cluster {} done", clusterId);
        } finally {
            syncingClusters.remove(clusterId);
        }
    }

    public void runPeriodically(K8sClusterClient client, Duration period) throws SQLException, InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            fullSync(client);
            Thread.sleep(period.toMillis());
        }
        throw new InterruptedException();
    }

    private static K8sObjectMeta identity(K8sObjectMeta obj) {
        return new K8sObjectMeta(obj.name(), obj.namespace(), obj.cluster(), obj.gvk());
    }
}
