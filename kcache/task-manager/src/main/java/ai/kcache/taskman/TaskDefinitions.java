package ai.kcache.taskman;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable ordered set of named task factories.
 */
public final class TaskDefinitions {
    private final Map<String, TaskFactory> tasks;

    private TaskDefinitions(Map<String, TaskFactory> tasks) {
        this.tasks = Collections.unmodifiableMap(tasks);
    }

    public static TaskDefinitions empty() {
        return new TaskDefinitions(new LinkedHashMap<>());
    }

    public static TaskDefinitions single(String name, TaskFactory factory) {
        var map = new LinkedHashMap<String, TaskFactory>();
        map.put(name, factory);
        return new TaskDefinitions(map);
    }

    public static TaskDefinitions of(Map<String, TaskFactory> tasks) {
        return new TaskDefinitions(new LinkedHashMap<>(tasks));
    }

    /**
     * Definitions of {@code other} win on name clashes.
     */
    public TaskDefinitions merge(TaskDefinitions other) {
        var map = new LinkedHashMap<>(tasks);
        map.putAll(other.tasks);
        return new TaskDefinitions(map);
    }

    public Map<String, TaskFactory> tasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }
}
