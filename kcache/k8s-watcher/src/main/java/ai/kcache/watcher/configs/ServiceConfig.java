package ai.kcache.watcher.configs;

import ai.kcache.db.DatabaseConfiguration;
import ai.kcache.k8s.client.UserIdExtractor;
import ai.kcache.k8s.model.Gvk;
import io.micronaut.context.annotation.ConfigurationBuilder;
import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.annotation.Nullable;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties("kcache")
public class ServiceConfig {
    // namespace of the default cluster, taken from the kube config if not set
    @Nullable
    private String namespace;
    private String defaultClusterId = "default";
    @Nullable
    private String kubeConfigRoot;

    private boolean requireUserId = false;

    // group/version/Kind or version/Kind
    private List<String> cachedKinds = new ArrayList<>();
    private Map<String, String> userIdLabels = new HashMap<>(UserIdExtractor.DEFAULT_LABELS);
    private Map<String, String> fixedUserIds = new HashMap<>();

    private Duration fullSyncPeriod = Duration.ofMinutes(10);
    private Duration deletedRetention = Duration.ofDays(1);
    private int listPageSize = 100;

    @ConfigurationBuilder("database")
    private final DatabaseConfiguration database = new DatabaseConfiguration();

    public List<Gvk> parsedCachedKinds() {
        return cachedKinds.stream().map(Gvk::parse).toList();
    }

    @Getter
    @Setter
    @ConfigurationProperties("task-manager")
    public static final class TaskManagerConfig {
        private Duration maxRetryWait = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    @ConfigurationProperties("admin")
    public static final class AdminConfig {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 8090;
    }
}
