package ai.kcache.taskman;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class TaskJoin {
    private final String name;
    private final CompletableFuture<Void> done;

    TaskJoin(String name, CompletableFuture<Void> done) {
        this.name = name;
        this.done = done;
    }

    public String name() {
        return name;
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * Waits for the task termination.
     *
     * @return {@code false} if the task is still running after the timeout
     */
    public boolean join(Duration timeout) throws InterruptedException {
        try {
            done.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // never completed exceptionally
            throw new IllegalStateException(e.getCause());
        }
    }
}
