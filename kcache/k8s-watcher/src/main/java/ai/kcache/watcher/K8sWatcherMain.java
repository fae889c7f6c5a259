package ai.kcache.watcher;

import ai.kcache.taskman.TaskManager;
import ai.kcache.taskman.admin.AdminConsole;
import ai.kcache.watcher.configs.ServiceConfig;
import ai.kcache.watcher.tasks.WatcherTaskDefinitions;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

@Singleton
public class K8sWatcherMain {
    private static final Logger LOG = LogManager.getLogger(K8sWatcherMain.class);

    public static final String APP = "KcacheWatcher";

    private final ServiceConfig.TaskManagerConfig taskManagerConfig;
    private final ServiceConfig.AdminConfig adminConfig;
    private final TaskManager taskManager;
    private final WatcherTaskDefinitions taskDefinitions;
    private final AdminConsole adminConsole;
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final CountDownLatch termination = new CountDownLatch(1);

    public K8sWatcherMain(ServiceConfig.TaskManagerConfig taskManagerConfig, ServiceConfig.AdminConfig adminConfig,
                          TaskManager taskManager, WatcherTaskDefinitions taskDefinitions, AdminConsole adminConsole)
    {
        this.taskManagerConfig = taskManagerConfig;
        this.adminConfig = adminConfig;
        this.taskManager = taskManager;
        this.taskDefinitions = taskDefinitions;
        this.adminConsole = adminConsole;
    }

    public void start() throws IOException {
        var defs = taskDefinitions.definitions();
        LOG.info("Starting {} with tasks {}", APP, defs.tasks().keySet());
        taskManager.startAll(defs);

        if (adminConfig.isEnabled()) {
            adminConsole.start();
        }
    }

    public void stop() {
        if (!terminated.compareAndSet(false, true)) {
            return;
        }

        LOG.info("Shutdown {}...", APP);
        try {
            adminConsole.close();
        } catch (IOException e) {
            LOG.error("Cannot close admin console: {}", e.getMessage(), e);
        }

        try {
            if (!taskManager.shutdown(taskManagerConfig.getShutdownTimeout())) {
                LOG.error("Not all tasks were terminated in {}", taskManagerConfig.getShutdownTimeout());
            }
        } catch (InterruptedException e) {
            LOG.error("Tasks shutdown was interrupted: {}", e.getMessage(), e);
            Thread.currentThread().interrupt();
        }
        termination.countDown();
    }

    public void awaitTermination() throws InterruptedException {
        LOG.info("Awaiting termination...");
        termination.await();
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        final ApplicationContext context = Micronaut.build(args)
            .banner(false)
            .eagerInitSingletons(true)
            .mainClass(K8sWatcherMain.class)
            .start();

        final var main = context.getBean(K8sWatcherMain.class);
        main.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            main.stop();
            context.close();
        }, "main-shutdown-hook"));

        main.awaitTermination();
    }
}
