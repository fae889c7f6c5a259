package ai.kcache.watcher;

import ai.kcache.db.Storage;
import ai.kcache.k8s.cache.K8sDbCache;
import ai.kcache.k8s.cache.K8sObjectCache;
import ai.kcache.k8s.client.K8sCachedClusterClient;
import ai.kcache.k8s.client.K8sClusterClient;
import ai.kcache.k8s.client.K8sClusterClientsPool;
import ai.kcache.k8s.client.ManifestConverter;
import ai.kcache.k8s.client.UserIdExtractor;
import ai.kcache.k8s.config.KubeConfigLoader;
import ai.kcache.k8s.sync.K8sCacheSynchronizer;
import ai.kcache.k8s.sync.K8sWatcher;
import ai.kcache.taskman.TaskManager;
import ai.kcache.taskman.admin.AdminConsole;
import ai.kcache.watcher.configs.ServiceConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.nio.file.Path;
import java.util.HashSet;

@Factory
public class BeanFactory {

    @Singleton
    @Named("KcacheObjectMapper")
    public ObjectMapper mapper() {
        return new ObjectMapper();
    }

    @Singleton
    public K8sObjectCache cache(Storage storage, ServiceConfig config,
                                @Named("KcacheObjectMapper") ObjectMapper mapper)
    {
        return new K8sDbCache(storage, mapper, config.isRequireUserId(), config.getListPageSize());
    }

    @Singleton
    public KubeConfigLoader kubeConfigLoader() {
        return new KubeConfigLoader();
    }

    @Singleton
    public ManifestConverter manifestConverter(ServiceConfig config,
                                               @Named("KcacheObjectMapper") ObjectMapper mapper)
    {
        return new ManifestConverter(mapper, new UserIdExtractor(config.getUserIdLabels(), config.getFixedUserIds()));
    }

    @Singleton
    @Bean(preDestroy = "close")
    public ClusterClients clusterClients(ServiceConfig config, KubeConfigLoader loader, ManifestConverter converter,
                                         K8sObjectCache cache)
    {
        var kubeConfigRoot = config.getKubeConfigRoot() != null ? Path.of(config.getKubeConfigRoot()) : null;
        var kinds = new HashSet<>(config.parsedCachedKinds());

        var clients = loader.load(config.getDefaultClusterId(), config.getNamespace(), kubeConfigRoot).stream()
            .map(cluster -> new K8sClusterClient(cluster, converter, config.getListPageSize()))
            .map(live -> new K8sCachedClusterClient(live, cache, kinds))
            .toList();
        return new ClusterClients(clients);
    }

    @Singleton
    public K8sClusterClientsPool clientsPool(ClusterClients clusterClients) {
        return K8sClusterClientsPool.of(clusterClients.clients());
    }

    @Singleton
    public K8sCacheSynchronizer synchronizer(ServiceConfig config, K8sObjectCache cache) {
        return new K8sCacheSynchronizer(cache, config.parsedCachedKinds(), config.getDeletedRetention());
    }

    @Singleton
    public K8sWatcher watcher(K8sObjectCache cache, K8sCacheSynchronizer synchronizer) {
        return new K8sWatcher(cache, synchronizer);
    }

    @Singleton
    public TaskManager taskManager(ServiceConfig.TaskManagerConfig config) {
        return new TaskManager(config.getMaxRetryWait());
    }

    @Singleton
    @Bean(preDestroy = "close")
    public AdminConsole adminConsole(TaskManager taskManager, ServiceConfig.AdminConfig config) {
        return new AdminConsole(taskManager, config.getHost(), config.getPort());
    }
}
