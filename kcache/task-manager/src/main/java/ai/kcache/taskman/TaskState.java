package ai.kcache.taskman;

public enum TaskState {
    RUNNING,
    RESTARTING,
    CANCELLED
}
