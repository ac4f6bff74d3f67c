package kz.qazmarka.orch.job;

import java.util.Objects;

/** Снимок состояния одной задачи. */
public final class TaskStatus {

    private final String taskId;
    private final TaskState state;
    private final Integer exitCode;
    private final String failure;

    public TaskStatus(String taskId, TaskState state, Integer exitCode, String failure) {
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.state = Objects.requireNonNull(state, "state");
        this.exitCode = exitCode;
        this.failure = failure;
    }

    public static TaskStatus of(String taskId, TaskState state) {
        return new TaskStatus(taskId, state, null, null);
    }

    public static TaskStatus completed(String taskId, int exitCode) {
        return new TaskStatus(taskId, TaskState.COMPLETED, exitCode, null);
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getState() {
        return state;
    }

    /** Код выхода; {@code null}, пока задача не завершена или не запустилась. */
    public Integer getExitCode() {
        return exitCode;
    }

    /** Описание сбоя запуска/выполнения; {@code null}, если его не было. */
    public String getFailure() {
        return failure;
    }

    /** Завершена с ненулевым кодом или со сбоем. */
    public boolean isFailed() {
        return state == TaskState.COMPLETED
                && (failure != null || exitCode == null || exitCode != 0);
    }

    @Override
    public String toString() {
        return taskId + '[' + state
                + (exitCode == null ? "" : ", exit=" + exitCode)
                + (failure == null ? "" : ", failure=" + failure) + ']';
    }
}
