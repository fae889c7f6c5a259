package ai.kcache.k8s.config;

import ai.kcache.k8s.model.ClusterConnection;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds connections of the configured clusters: the default one (in-cluster or local kubeconfig)
 * and one per kubeconfig file in the root directory. The file name without extension is the cluster id.
 */
public class KubeConfigLoader {
    private static final Logger LOG = LogManager.getLogger(KubeConfigLoader.class);

    public static final String DEFAULT_NAMESPACE = "default";

    private final Function<Config, KubernetesClient> clientFactory;

    public KubeConfigLoader(Function<Config, KubernetesClient> clientFactory) {
        this.clientFactory = clientFactory;
    }

    public KubeConfigLoader() {
        this(config -> new KubernetesClientBuilder().withConfig(config).build());
    }

    /**
     * @param namespace overrides the namespace of the default kube config, if set
     * @param kubeConfigRoot directory with additional kube configs, may be absent
     */
    public List<ClusterConnection> load(String defaultClusterId, @Nullable String namespace,
                                        @Nullable Path kubeConfigRoot)
    {
        var clusters = new ArrayList<ClusterConnection>();
        clusters.add(connect(defaultClusterId, Config.autoConfigure(null), namespace));

        if (kubeConfigRoot == null) {
            return clusters;
        }
        if (!Files.isDirectory(kubeConfigRoot)) {
            LOG.warn("Cannot open directory '{}', ignoring kube configs...", kubeConfigRoot);
            return clusters;
        }

        List<Path> files;
        try (var stream = Files.list(kubeConfigRoot)) {
            files = stream
                .filter(Files::isRegularFile)
                .sorted(Comparator.comparing(Path::getFileName))
                .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.error("Cannot list kube configs in '{}': {}", kubeConfigRoot, e.getMessage(), e);
            return clusters;
        }

        for (var file : files) {
            var clusterId = clusterId(file);
            if (clusters.stream().anyMatch(c -> c.id().equals(clusterId))) {
                LOG.warn("Duplicate cluster id '{}' of kube config '{}', ignoring it", clusterId, file);
                continue;
            }
            try {
                var config = Config.fromKubeconfig(Files.readString(file));
                clusters.add(connect(clusterId, config, null));
                LOG.info("Successfully loaded Kubernetes config: '{}'", file);
            } catch (Exception e) {
                LOG.warn("Failed while loading '{}', ignoring kube config. Error: {}", file, e.getMessage());
            }
        }
        return clusters;
    }

    private ClusterConnection connect(String clusterId, Config config, @Nullable String namespace) {
        var ns = namespace != null ? namespace : config.getNamespace();
        if (ns == null || ns.isEmpty()) {
            ns = DEFAULT_NAMESPACE;
        }
        config.setNamespace(ns);
        return new ClusterConnection(clusterId, ns, clientFactory.apply(config));
    }

    static String clusterId(Path file) {
        var name = file.getFileName().toString();
        var dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
