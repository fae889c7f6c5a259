package ai.kcache.taskman;

import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs named tasks on their own threads and restarts the failed ones with exponential backoff.
 */
public class TaskManager {
    private static final Logger LOG = LogManager.getLogger(TaskManager.class);

    private final Map<String, TaskContext> tasks = new ConcurrentHashMap<>();
    private final Duration maxRetryWait;

    public TaskManager(Duration maxRetryWait) {
        this.maxRetryWait = maxRetryWait;
    }

    public void startAll(TaskDefinitions definitions) {
        definitions.tasks().forEach(this::start);
    }

    public void start(String name, TaskFactory factory) {
        var ctx = new TaskContext(name);
        if (tasks.putIfAbsent(name, ctx) != null) {
            LOG.warn("{}: not starting task, it is already running", name);
            return;
        }

        LOG.info("{}: starting...", name);
        var thread = new Thread(() -> supervise(ctx, factory), "task-" + name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) ->
            LOG.error("Unexpected exception in thread {}: {}", t.getName(), e.getMessage(), e));
        ctx.runner = thread;
        thread.start();
    }

    /**
     * Requests cancellation of the task. A cancelled task is never restarted.
     *
     * @return handle to wait for the termination, {@code null} if there is no such task
     */
    @Nullable
    public TaskJoin cancel(String name) {
        var ctx = tasks.get(name);
        if (ctx == null) {
            return null;
        }

        LOG.info("{}: cancelling task", name);
        ctx.cancelRequested = true;
        ctx.state = TaskState.CANCELLED;
        var runner = ctx.runner;
        if (runner != null) {
            runner.interrupt();
        }
        return new TaskJoin(name, ctx.done);
    }

    public List<TaskView> currentTasks() {
        return tasks.values().stream()
            .map(TaskContext::view)
            .sorted(Comparator.comparing(TaskView::name))
            .toList();
    }

    @Nullable
    public TaskView getTaskView(String name) {
        var ctx = tasks.get(name);
        return ctx != null ? ctx.view() : null;
    }

    @Nullable
    public TaskJoin getTaskJoin(String name) {
        var ctx = tasks.get(name);
        return ctx != null ? new TaskJoin(name, ctx.done) : null;
    }

    /**
     * @return {@code false} if there is no such task
     */
    public boolean resetRestarts(String name) {
        var ctx = tasks.get(name);
        if (ctx == null) {
            return false;
        }
        ctx.restarts.set(0);
        return true;
    }

    public void resetAllRestarts() {
        tasks.values().forEach(ctx -> ctx.restarts.set(0));
    }

    /**
     * Cancels every task and waits for them.
     *
     * @return {@code true} if all tasks terminated in time
     */
    public boolean shutdown(Duration timeout) throws InterruptedException {
        LOG.info("Shutdown task manager, running tasks: {}", tasks.keySet());

        var joins = tasks.keySet().stream()
            .map(this::cancel)
            .filter(j -> j != null)
            .toList();

        var deadline = Instant.now().plus(timeout);
        var ok = true;
        for (var join : joins) {
            var left = Duration.between(Instant.now(), deadline);
            if (!join.join(left.isNegative() ? Duration.ZERO : left)) {
                LOG.error("{}: task was not terminated in {}", join.name(), timeout);
                ok = false;
            }
        }
        return ok;
    }

    @VisibleForTesting
    Duration retryWait(int previousRestarts) {
        if (previousRestarts >= 30) {
            return maxRetryWait;
        }
        var wait = Duration.ofSeconds(1L << previousRestarts);
        return wait.compareTo(maxRetryWait) < 0 ? wait : maxRetryWait;
    }

    private void supervise(TaskContext ctx, TaskFactory factory) {
        try {
            while (!ctx.cancelRequested) {
                try {
                    factory.create().run();
                    LOG.info("{}: finished in {}s", ctx.name,
                        Duration.between(ctx.started, Instant.now()).toSeconds());
                    return;
                } catch (Throwable e) {
                    if (ctx.cancelRequested) {
                        LOG.info("{}: cancelled", ctx.name);
                        return;
                    }

                    var previous = ctx.restarts.getAndIncrement();
                    var wait = retryWait(previous);
                    LOG.error("{}: failed with {}. Restarting it in {} for the {}. time",
                        ctx.name, e.getMessage(), wait, previous + 1, e);
                    ctx.state = TaskState.RESTARTING;

                    // the failure may have left the interrupted flag behind;
                    // cancel() sets cancelRequested before it interrupts
                    Thread.interrupted();
                    if (ctx.cancelRequested) {
                        LOG.info("{}: cancelled", ctx.name);
                        return;
                    }
                    try {
                        Thread.sleep(wait.toMillis());
                    } catch (InterruptedException ie) {
                        if (ctx.cancelRequested) {
                            LOG.info("{}: cancelled", ctx.name);
                            return;
                        }
                        LOG.warn("{}: interrupted while waiting for restart, restarting now", ctx.name);
                    }
                }

                if (!ctx.cancelRequested) {
                    ctx.started = Instant.now();
                    ctx.state = TaskState.RUNNING;
                }
            }
        } finally {
            tasks.remove(ctx.name, ctx);
            LOG.debug("{}: removed from running set", ctx.name);
            ctx.done.complete(null);
        }
    }

    private static final class TaskContext {
        private final String name;
        private final AtomicInteger restarts = new AtomicInteger(0);
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private volatile Instant started = Instant.now();
        private volatile TaskState state = TaskState.RUNNING;
        private volatile Thread runner;
        private volatile boolean cancelRequested = false;

        private TaskContext(String name) {
            this.name = name;
        }

        private TaskView view() {
            return new TaskView(name, started, restarts.get(), state);
        }
    }
}
