package kz.qazmarka.orch.job;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Задание не завершилось за отведённое время и было прервано. */
public class JobTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String jobId;
    private final transient List<TaskStatus> lastSeen;

    public JobTimeoutException(String jobId, Duration timeout, List<TaskStatus> lastSeen) {
        super("Задание '" + jobId + "' не завершилось за " + timeout + " и прервано; последнее состояние: " + lastSeen);
        this.jobId = jobId;
        this.lastSeen = Collections.unmodifiableList(new ArrayList<>(lastSeen));
    }

    public String getJobId() {
        return jobId;
    }

    /** Состояние задач на момент таймаута. */
    public List<TaskStatus> getLastSeen() {
        return lastSeen;
    }
}
