package kz.qazmarka.orch.job;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Задание для пула исполнителей: идентификаторы пула и задания, файлы-ресурсы, которые нужно
 * доставить на узел перед запуском, и команды задач (по задаче на команду).
 */
public final class JobSubmission {

    private final String poolId;
    private final String jobId;
    private final List<String> resourceFiles;
    private final List<String> taskCommands;

    public JobSubmission(String poolId, String jobId, List<String> resourceFiles, List<String> taskCommands) {
        this.poolId = requireText(poolId, "poolId");
        this.jobId = requireText(jobId, "jobId");
        this.resourceFiles = Collections.unmodifiableList(new ArrayList<>(
                resourceFiles == null ? Collections.<String>emptyList() : resourceFiles));
        Objects.requireNonNull(taskCommands, "taskCommands");
        if (taskCommands.isEmpty()) {
            throw new IllegalArgumentException("Задание '" + jobId + "' не содержит ни одной задачи");
        }
        this.taskCommands = Collections.unmodifiableList(new ArrayList<>(taskCommands));
    }

    private static String requireText(String v, String name) {
        if (v == null || v.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " не может быть пустым");
        }
        return v.trim();
    }

    public String getPoolId() {
        return poolId;
    }

    public String getJobId() {
        return jobId;
    }

    public List<String> getResourceFiles() {
        return resourceFiles;
    }

    public List<String> getTaskCommands() {
        return taskCommands;
    }
}
