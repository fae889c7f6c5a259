package ai.kcache.taskman;

import java.time.Instant;

/**
 * Snapshot of a registered task.
 *
 * @param started time of the last start or restart
 */
public record TaskView(
    String name,
    Instant started,
    int restarts,
    TaskState state
) {}
