package kz.qazmarka.orch.job;

/** Состояние задачи задания; порядок констант: порядок жизненного цикла. */
public enum TaskState {
    ACTIVE,
    PREPARING,
    RUNNING,
    COMPLETED
}
