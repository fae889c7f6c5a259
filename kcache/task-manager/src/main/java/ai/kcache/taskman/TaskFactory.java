package ai.kcache.taskman;

/**
 * Produces a fresh {@link TaskBody} for every (re)start of a task.
 */
@FunctionalInterface
public interface TaskFactory {
    TaskBody create() throws Exception;
}
