package ai.kcache.k8s.client;

import ai.kcache.db.exceptions.UncheckedSqlException;
import ai.kcache.k8s.cache.K8sObjectCache;
import ai.kcache.k8s.model.ClusterConnection;
import ai.kcache.k8s.model.Gvk;
import ai.kcache.k8s.model.K8sObject;
import ai.kcache.k8s.model.K8sObjectFilter;
import ai.kcache.k8s.model.K8sObjectMeta;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Cluster client which serves reads from the cache and writes every change both to the cluster and the cache.
 * Kinds outside of {@code kindsToCache} bypass the cache; an empty set caches every kind.
 */
public class K8sCachedClusterClient implements K8sClient {
    private static final Logger LOG = LogManager.getLogger(K8sCachedClusterClient.class);

    private final K8sClusterClient live;
    private final K8sObjectCache cache;
    private final Set<Gvk> kindsToCache;

    public K8sCachedClusterClient(K8sClusterClient live, K8sObjectCache cache, Set<Gvk> kindsToCache) {
        this.live = live;
        this.cache = cache;
        this.kindsToCache = Set.copyOf(kindsToCache);
    }

    public K8sCachedClusterClient(K8sClusterClient live, K8sObjectCache cache) {
        this(live, cache, Set.of());
    }

    public ClusterConnection cluster() {
        return live.cluster();
    }

    public K8sClusterClient live() {
        return live;
    }

    public boolean cached(Gvk gvk) {
        return kindsToCache.isEmpty() || kindsToCache.contains(gvk);
    }

    @Override
    public K8sObject create(K8sObject obj, boolean refresh) {
        var created = live.create(obj, refresh);
        if (cached(obj.gvk())) {
            upsert(created);
        }
        return created;
    }

    @Nullable
    @Override
    public K8sObject get(K8sObjectMeta meta) {
        if (!cached(meta.gvk())) {
            return live.get(meta);
        }

        try {
            var cachedObj = cache.get(meta);
            if (cachedObj != null) {
                return cachedObj;
            }
        } catch (SQLException e) {
            throw new UncheckedSqlException(e);
        }

        LOG.debug("Cache miss for {}", meta);
        var obj = live.get(meta);
        if (obj != null) {
            upsert(obj);
        }
        return obj;
    }

    @Override
    public K8sObject patch(K8sObjectMeta meta, Map<String, Object> patch) {
        var patched = live.patch(meta, patch);
        if (cached(meta.gvk())) {
            upsert(patched);
        }
        return patched;
    }

    @Override
    public K8sObject jsonPatch(K8sObjectMeta meta, List<Map<String, Object>> operations) {
        var patched = live.jsonPatch(meta, operations);
        if (cached(meta.gvk())) {
            upsert(patched);
        }
        return patched;
    }

    @Override
    public void delete(K8sObjectMeta meta, DeletionPropagation propagation) {
        live.delete(meta, propagation);
        if (cached(meta.gvk())) {
            try {
                cache.delete(meta.withUserId(null));
            } catch (SQLException e) {
                throw new UncheckedSqlException(e);
            }
        }
    }

    @Override
    public Stream<K8sObject> list(K8sObjectFilter filter) {
        if (filter.cluster() != null && !filter.cluster().equals(live.clusterId())) {
            return Stream.empty();
        }

        if (filter.kind() != null && filter.version() != null
            && !cached(Gvk.of(filter.group(), filter.version(), filter.kind())))
        {
            return live.list(filter);
        }

        try {
            return cache.list(filter.withCluster(live.clusterId()));
        } catch (SQLException e) {
            throw new UncheckedSqlException(e);
        }
    }

    private void upsert(K8sObject obj) {
        if (cache.requiresUserId() && obj.userId() == null) {
            LOG.warn("Object {} has no user id, skip caching", obj.meta());
            return;
        }
        try {
            cache.upsert(obj);
        } catch (SQLException e) {
            throw new UncheckedSqlException(e);
        }
    }

    @Override
    public String toString() {
        return "K8sCachedClusterClient{cluster=%s}".formatted(live.clusterId());
    }
}
