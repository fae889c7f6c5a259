package ai.kcache.taskman;

/**
 * A unit of work run by the {@link TaskManager}. Returning normally ends the task, throwing restarts it.
 * Bodies must react to thread interruption, it is how tasks are cancelled.
 */
@FunctionalInterface
public interface TaskBody {
    void run() throws Exception;
}
