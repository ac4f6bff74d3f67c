package kz.qazmarka.orch.job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Итог завершённого задания: коды выхода и упавшие задачи. */
public final class JobOutcome {

    private final String jobId;
    private final List<TaskStatus> tasks;
    private final Duration elapsed;

    JobOutcome(String jobId, List<TaskStatus> tasks, Duration elapsed) {
        this.jobId = jobId;
        this.tasks = Collections.unmodifiableList(new ArrayList<>(tasks));
        this.elapsed = elapsed;
    }

    public String getJobId() {
        return jobId;
    }

    public List<TaskStatus> getTasks() {
        return tasks;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    /** Код выхода по идентификатору задачи (в порядке задач). */
    public Map<String, Integer> exitCodes() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (TaskStatus t : tasks) {
            out.put(t.getTaskId(), t.getExitCode());
        }
        return out;
    }

    public List<TaskStatus> failedTasks() {
        List<TaskStatus> out = new ArrayList<>();
        for (TaskStatus t : tasks) {
            if (t.isFailed()) {
                out.add(t);
            }
        }
        return out;
    }

    public boolean isSuccess() {
        return failedTasks().isEmpty();
    }

    @Override
    public String toString() {
        return "JobOutcome{job=" + jobId + ", tasks=" + tasks.size() + ", failed=" + failedTasks().size()
                + ", elapsed=" + elapsed + '}';
    }
}
