package ai.kcache.watcher.tasks;

import ai.kcache.k8s.sync.K8sCacheSynchronizer;
import ai.kcache.k8s.sync.K8sWatcher;
import ai.kcache.taskman.TaskDefinitions;
import ai.kcache.watcher.ClusterClients;
import ai.kcache.watcher.configs.ServiceConfig;
import jakarta.inject.Singleton;

import java.util.Locale;

/**
 * One periodic full sync per cluster and one watch per (cluster, cached kind).
 */
@Singleton
public class WatcherTaskDefinitions {
    private final ServiceConfig config;
    private final ClusterClients clusterClients;
    private final K8sCacheSynchronizer synchronizer;
    private final K8sWatcher watcher;

    public WatcherTaskDefinitions(ServiceConfig config, ClusterClients clusterClients,
                                  K8sCacheSynchronizer synchronizer, K8sWatcher watcher)
    {
        this.config = config;
        this.clusterClients = clusterClients;
        this.synchronizer = synchronizer;
        this.watcher = watcher;
    }

    public static String fullSyncTaskName(String clusterId) {
        return "full-sync-" + clusterId;
    }

    public static String watchTaskName(String clusterId, String kind) {
        return "watch-%s-%s".formatted(clusterId, kind.toLowerCase(Locale.ROOT));
    }

    public TaskDefinitions definitions() {
        var defs = TaskDefinitions.empty();
        for (var client : clusterClients.clients()) {
            var live = client.live();
            var clusterId = live.clusterId();

            defs = defs.merge(TaskDefinitions.single(fullSyncTaskName(clusterId),
                () -> () -> synchronizer.runPeriodically(live, config.getFullSyncPeriod())));

            for (var gvk : synchronizer.kinds()) {
                defs = defs.merge(TaskDefinitions.single(watchTaskName(clusterId, gvk.kind()),
                    () -> () -> watcher.watch(live, gvk)));
            }
        }
        return defs;
    }
}
